package com.phillippitts.querybridge.service.queue;

import com.phillippitts.querybridge.domain.QueryResult;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Caller-side reference to a submitted job.
 *
 * <p>{@link #future()} returns a copy of the job's completion, so completing or cancelling
 * it has no effect on the job itself.
 */
public final class JobHandle {

    private final String id;
    private final CompletableFuture<QueryResult> completion;

    JobHandle(String id, CompletableFuture<QueryResult> completion) {
        this.id = Objects.requireNonNull(id, "id");
        this.completion = Objects.requireNonNull(completion, "completion");
    }

    public String id() {
        return id;
    }

    public CompletableFuture<QueryResult> future() {
        return completion.copy();
    }

    @Override
    public String toString() {
        return "JobHandle[" + id + "]";
    }
}
