package com.phillippitts.querybridge.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Cache payload: the parts of a worker answer that are safe to replay to any caller.
 *
 * @param answer answer text
 * @param sources supporting passages
 * @param cachedAt when the entry was written
 */
public record CachedAnswer(String answer, List<String> sources, Instant cachedAt) {

    public CachedAnswer {
        Objects.requireNonNull(answer, "answer must not be null");
        sources = sources == null ? List.of() : List.copyOf(sources);
        if (cachedAt == null) {
            cachedAt = Instant.now();
        }
    }

    public static CachedAnswer of(WorkerAnswer workerAnswer) {
        return new CachedAnswer(workerAnswer.answer(), workerAnswer.sources(), Instant.now());
    }
}
