package com.phillippitts.querybridge.exception;

import java.util.Map;

/**
 * Thrown for the request that was in flight when the worker process died, closed its
 * streams, could not be written to, or never signalled readiness.
 */
public class WorkerCrashedException extends QueryBridgeException {

    public WorkerCrashedException(String message) {
        super(ErrorKind.WORKER_CRASHED, message);
    }

    public WorkerCrashedException(String message, Throwable cause) {
        super(ErrorKind.WORKER_CRASHED, message, cause);
    }

    public WorkerCrashedException(String message, Map<String, String> details, Throwable cause) {
        super(ErrorKind.WORKER_CRASHED, message, details, cause);
    }
}
