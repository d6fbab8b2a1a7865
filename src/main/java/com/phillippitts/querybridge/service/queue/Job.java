package com.phillippitts.querybridge.service.queue;

import com.phillippitts.querybridge.domain.ContextTurn;
import com.phillippitts.querybridge.domain.JobSnapshot;
import com.phillippitts.querybridge.domain.JobStage;
import com.phillippitts.querybridge.domain.JobState;
import com.phillippitts.querybridge.domain.QueryResult;
import com.phillippitts.querybridge.exception.ErrorKind;
import com.phillippitts.querybridge.exception.QueryBridgeException;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable job record owned by the queue. Every state change is synchronized on the job.
 *
 * <p>Each time a processor picks the job up it receives a fresh attempt token. Progress,
 * completion and failure calls must present the current token; calls from an attempt that
 * was declared stalled are rejected, which is how late results get discarded.
 *
 * <p>An active attempt holds a lease that its processor keeps renewing. The job is stalled
 * only once the lease lapses or is revoked, never because the attempt is merely slow.
 *
 * <p>The terminal state is set exactly once, and only then is the completion future completed.
 */
final class Job {

    private final String id;
    private final String query;
    private final String callerId;
    private final String sessionId;
    private final List<ContextTurn> context;
    private final Instant createdAt;
    private final CompletableFuture<QueryResult> completion = new CompletableFuture<>();

    private JobState state = JobState.WAITING;
    private int progress = JobStage.QUEUED.percent();
    private QueryResult result;
    private QueryBridgeException failure;
    private int attempts;
    private int stalledCount;
    private long attemptToken;
    private long leaseExpiresNanos;
    private boolean leaseRevoked;
    private Instant processedAt;
    private Instant finishedAt;

    Job(String id, String query, String callerId, String sessionId, List<ContextTurn> context, Instant createdAt) {
        this.id = id;
        this.query = query;
        this.callerId = callerId;
        this.sessionId = sessionId;
        this.context = List.copyOf(context);
        this.createdAt = createdAt;
    }

    String id() {
        return id;
    }

    String query() {
        return query;
    }

    String callerId() {
        return callerId;
    }

    String sessionId() {
        return sessionId;
    }

    List<ContextTurn> context() {
        return context;
    }

    CompletableFuture<QueryResult> completion() {
        return completion;
    }

    /**
     * WAITING -> ACTIVE.
     *
     * @return the attempt token, or -1 if the job is no longer waiting
     */
    synchronized long activate(Instant now, long leaseNanos) {
        if (state != JobState.WAITING) {
            return -1;
        }
        state = JobState.ACTIVE;
        attempts++;
        attemptToken++;
        leaseExpiresNanos = System.nanoTime() + leaseNanos;
        leaseRevoked = false;
        processedAt = now;
        return attemptToken;
    }

    /**
     * Extends the lease of the current attempt to {@code untilNanos} ({@link System#nanoTime()} base).
     *
     * @return false if the token is stale
     */
    synchronized boolean renewLease(long token, long untilNanos) {
        if (!isCurrent(token) || leaseRevoked) {
            return false;
        }
        leaseExpiresNanos = untilNanos;
        return true;
    }

    /**
     * Gives up the lease of the current attempt; the next stall sweep picks the job up.
     */
    synchronized boolean revokeLease(long token) {
        if (!isCurrent(token)) {
            return false;
        }
        leaseRevoked = true;
        return true;
    }

    /**
     * Raises progress to the stage's percentage; never lowers it.
     *
     * @return false if the token is stale
     */
    synchronized boolean advance(long token, JobStage stage) {
        if (!isCurrent(token)) {
            return false;
        }
        progress = Math.max(progress, stage.percent());
        return true;
    }

    synchronized boolean complete(long token, QueryResult value, Instant now) {
        if (!isCurrent(token)) {
            return false;
        }
        progress = JobStage.COMPLETE.percent();
        state = JobState.COMPLETED;
        result = value;
        finishedAt = now;
        completion.complete(value);
        return true;
    }

    synchronized boolean fail(long token, QueryBridgeException error, Instant now) {
        if (!isCurrent(token)) {
            return false;
        }
        return failTerminal(error, now);
    }

    /**
     * Fails the job from any non-terminal state.
     *
     * @return false if it had already finished
     */
    synchronized boolean failTerminal(QueryBridgeException error, Instant now) {
        if (state.isTerminal()) {
            return false;
        }
        state = JobState.FAILED;
        failure = error;
        finishedAt = now;
        completion.completeExceptionally(error);
        return true;
    }

    /**
     * ACTIVE -> STALLED when the lease was revoked or expired before {@code nowNanos}.
     *
     * @return the new stall count, or -1 if the job was not stalled
     */
    synchronized int markStalledIfLeaseLost(long nowNanos) {
        if (state != JobState.ACTIVE || (!leaseRevoked && nowNanos - leaseExpiresNanos < 0)) {
            return -1;
        }
        state = JobState.STALLED;
        stalledCount++;
        // invalidates the abandoned attempt
        attemptToken++;
        return stalledCount;
    }

    synchronized boolean markDelayed() {
        if (state != JobState.STALLED) {
            return false;
        }
        state = JobState.DELAYED;
        return true;
    }

    synchronized boolean markWaiting() {
        if (state != JobState.DELAYED) {
            return false;
        }
        state = JobState.WAITING;
        return true;
    }

    synchronized JobState state() {
        return state;
    }

    synchronized Instant finishedAt() {
        return finishedAt;
    }

    synchronized JobSnapshot snapshot() {
        ErrorKind kind = failure == null ? null : failure.getKind();
        String message = failure == null ? null : failure.getMessage();
        return new JobSnapshot(id, callerId, sessionId, state, progress, result, kind, message,
                attempts, stalledCount, createdAt, processedAt, finishedAt);
    }

    private boolean isCurrent(long token) {
        return state == JobState.ACTIVE && token == attemptToken;
    }
}
