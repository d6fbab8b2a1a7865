package com.phillippitts.querybridge.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base exception for all pipeline errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class QueryBridgeException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, String> details;

    public QueryBridgeException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    public QueryBridgeException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, Map.of(), cause);
    }

    public QueryBridgeException(ErrorKind kind, String message, Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.details = details == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Technical context attached to the failure (attempts, durations, exit codes).
     * Never contains query text.
     *
     * @return unmodifiable detail map, possibly empty
     */
    public Map<String, String> getDetails() {
        return details;
    }
}
