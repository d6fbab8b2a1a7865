package com.phillippitts.querybridge.exception;

/**
 * Thrown when a submitted query is null, blank, too long, or carries too much context.
 * Fails fast: the worker is never contacted and the call is never retried.
 */
public class QueryValidationException extends QueryBridgeException {

    private final String reason;

    public QueryValidationException(String reason) {
        super(ErrorKind.VALIDATION, "Invalid query: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
