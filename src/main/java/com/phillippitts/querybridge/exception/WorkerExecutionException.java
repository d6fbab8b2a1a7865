package com.phillippitts.querybridge.exception;

import java.util.Map;

/**
 * Thrown when the worker answered a request with an explicit failure payload,
 * or when such failures exhausted the retry budget.
 */
public class WorkerExecutionException extends QueryBridgeException {

    public WorkerExecutionException(String message) {
        super(ErrorKind.WORKER_EXECUTION, message);
    }

    public WorkerExecutionException(String message, Map<String, String> details, Throwable cause) {
        super(ErrorKind.WORKER_EXECUTION, message, details, cause);
    }
}
