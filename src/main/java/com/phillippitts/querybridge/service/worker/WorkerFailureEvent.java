package com.phillippitts.querybridge.service.worker;

import java.time.Instant;
import java.util.Map;

/**
 * Published when the worker process fails: crash, request timeout, startup timeout or spawn failure.
 *
 * <p>PII note: Do not include query text in context. Restrict to technical diagnostics.
 *
 * @param at when the failure was observed
 * @param reason short machine-readable reason ({@code crash}, {@code timeout}, ...)
 * @param message human-readable description
 * @param cause underlying exception, may be null
 * @param context technical details such as generation and exit code
 */
public record WorkerFailureEvent(
        Instant at,
        String reason,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public WorkerFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
