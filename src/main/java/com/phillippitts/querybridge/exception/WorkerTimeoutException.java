package com.phillippitts.querybridge.exception;

import java.util.Map;

/**
 * Thrown when the worker did not answer within the per-request budget.
 * The bridge recycles the worker process whenever this is raised for an in-flight request.
 */
public class WorkerTimeoutException extends QueryBridgeException {

    private final long timeoutMs;

    public WorkerTimeoutException(String message, long timeoutMs) {
        this(message, timeoutMs, Map.of("timeoutMs", String.valueOf(timeoutMs)), null);
    }

    public WorkerTimeoutException(String message, long timeoutMs, Map<String, String> details, Throwable cause) {
        super(ErrorKind.WORKER_TIMEOUT, message, details, cause);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
