package com.phillippitts.querybridge.domain;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Successful answer produced by the external worker.
 *
 * @param answer generated answer text (never null, may be empty)
 * @param sources supporting passages reported by the worker
 * @param usage worker-reported metadata such as counts; values are stringified
 * @param elapsedMs wall time of the bridge call including retries
 * @param success always true for answers handed to callers; failures are exceptions
 */
public record WorkerAnswer(
        String answer,
        List<String> sources,
        Map<String, String> usage,
        long elapsedMs,
        boolean success
) {

    public WorkerAnswer {
        Objects.requireNonNull(answer, "answer must not be null");
        sources = sources == null ? List.of() : List.copyOf(sources);
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    /**
     * Returns a copy stamped with the end-to-end elapsed time.
     */
    public WorkerAnswer withElapsedMs(long elapsed) {
        return new WorkerAnswer(answer, sources, usage, elapsed, success);
    }
}
