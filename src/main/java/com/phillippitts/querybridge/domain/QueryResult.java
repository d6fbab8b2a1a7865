package com.phillippitts.querybridge.domain;

import java.util.List;
import java.util.Objects;

/**
 * Final outcome of a processed job as delivered to the caller.
 *
 * @param answer generated answer text
 * @param sources supporting passages
 * @param cached true when served from the response cache without contacting the worker
 * @param elapsedMs processing time inside the job, not including queue wait
 * @param callerId caller the job was submitted for
 * @param sessionId session the job belongs to
 * @param jobId id of the job that produced this result
 */
public record QueryResult(
        String answer,
        List<String> sources,
        boolean cached,
        long elapsedMs,
        String callerId,
        String sessionId,
        String jobId
) {

    public QueryResult {
        Objects.requireNonNull(answer, "answer must not be null");
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
