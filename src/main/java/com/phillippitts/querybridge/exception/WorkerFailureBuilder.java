package com.phillippitts.querybridge.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for worker failures with rich contextual information.
 *
 * <p>Produces the {@link QueryBridgeException} subclass matching the chosen {@link ErrorKind}
 * and appends the collected context to the message so logs carry it even when only the
 * message is printed.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw WorkerFailureBuilder.create("Worker request timeout")
 *         .kind(ErrorKind.WORKER_TIMEOUT)
 *         .timeoutMs(30000)
 *         .durationMs(30012)
 *         .build();
 *
 * throw WorkerFailureBuilder.create("Worker failed after 2 attempts")
 *         .kind(ErrorKind.WORKER_EXECUTION)
 *         .attempts(2)
 *         .cause(lastError)
 *         .metadata("lastError", lastError.getMessage())
 *         .build();
 * </pre>
 */
public final class WorkerFailureBuilder {

    private final String message;
    private ErrorKind kind = ErrorKind.WORKER_EXECUTION;
    private Throwable cause;
    private Integer exitCode;
    private Integer attempts;
    private Long durationMs;
    private long timeoutMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private WorkerFailureBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static WorkerFailureBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new WorkerFailureBuilder(message);
    }

    public WorkerFailureBuilder kind(ErrorKind kind) {
        if (kind != null) {
            this.kind = kind;
        }
        return this;
    }

    public WorkerFailureBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public WorkerFailureBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public WorkerFailureBuilder attempts(int attempts) {
        this.attempts = attempts;
        return this;
    }

    public WorkerFailureBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Records the request budget; only meaningful for {@link ErrorKind#WORKER_TIMEOUT}.
     *
     * @param timeoutMs per-request timeout in milliseconds
     * @return this builder for chaining
     */
    public WorkerFailureBuilder timeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public WorkerFailureBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (exitCode={code}, attempts={n}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return exception of the subclass matching the configured kind
     */
    public QueryBridgeException build() {
        Map<String, String> details = collectDetails();
        String detailedMessage = buildDetailedMessage(details);

        return switch (kind) {
            case WORKER_TIMEOUT -> new WorkerTimeoutException(detailedMessage, timeoutMs, details, cause);
            case WORKER_CRASHED -> new WorkerCrashedException(detailedMessage, details, cause);
            case WORKER_EXECUTION -> new WorkerExecutionException(detailedMessage, details, cause);
            default -> new QueryBridgeException(kind, detailedMessage, details, cause);
        };
    }

    private Map<String, String> collectDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        if (exitCode != null) {
            details.put("exitCode", String.valueOf(exitCode));
        }
        if (attempts != null) {
            details.put("attempts", String.valueOf(attempts));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        if (kind == ErrorKind.WORKER_TIMEOUT && timeoutMs > 0) {
            details.put("timeoutMs", String.valueOf(timeoutMs));
        }
        details.putAll(metadata);
        return details;
    }

    private String buildDetailedMessage(Map<String, String> details) {
        if (details.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
