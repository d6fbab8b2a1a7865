package com.phillippitts.querybridge.exception;

import java.util.Map;

/**
 * Thrown when a caller's await budget elapses before its job reaches a terminal state.
 * Only the wait is abandoned; the job keeps running and a successful result is still cached.
 */
public class QueueTimeoutException extends QueryBridgeException {

    private final String jobId;

    public QueueTimeoutException(String jobId, long timeoutMs) {
        super(ErrorKind.QUEUE_TIMEOUT, "Request processing timeout after " + timeoutMs + "ms",
                Map.of("jobId", jobId, "timeoutMs", String.valueOf(timeoutMs)), null);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
