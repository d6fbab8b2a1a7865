package com.phillippitts.querybridge.exception;

/**
 * Machine-readable classification of pipeline failures.
 *
 * <p>Carried by every {@link QueryBridgeException} so the HTTP layer (or any other caller)
 * can map a failure to a transport status without inspecting messages.
 */
public enum ErrorKind {

    /** Malformed or oversized input; never retried, never reaches the worker. */
    VALIDATION(false),

    /** The worker ran and returned an explicit failure payload. */
    WORKER_EXECUTION(true),

    /** The worker did not answer within the request budget; the process is recycled. */
    WORKER_TIMEOUT(true),

    /** The worker process exited, closed its streams, or never became ready. */
    WORKER_CRASHED(false),

    /** The caller's await budget elapsed before the job finished. The job keeps running. */
    QUEUE_TIMEOUT(false),

    /** The job's processor was lost and the stall budget is exhausted. */
    JOB_STALLED(false),

    /** No job with the requested id is known to the queue. */
    JOB_NOT_FOUND(false),

    /** Anything else. */
    INTERNAL(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether the worker bridge may retry a call that failed with this kind.
     *
     * @return true for execution failures and timeouts
     */
    public boolean isRetryable() {
        return retryable;
    }
}
