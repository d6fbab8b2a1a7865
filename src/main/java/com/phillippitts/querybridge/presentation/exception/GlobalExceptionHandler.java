package com.phillippitts.querybridge.presentation.exception;

import com.phillippitts.querybridge.exception.ErrorKind;
import com.phillippitts.querybridge.exception.QueryBridgeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts pipeline failures to HTTP responses by {@link ErrorKind}.
 * Logs the full failure while keeping worker output, exit codes and stack traces away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(QueryBridgeException.class)
    ResponseEntity<ApiError> handlePipelineFailure(QueryBridgeException ex) {
        ErrorKind kind = ex.getKind();
        HttpStatus status = statusFor(kind);
        if (status.is5xxServerError()) {
            LOG.error("Query failed: kind={}, details={}", kind, ex.getDetails(), ex);
        } else {
            LOG.warn("Query rejected: kind={}, message={}", kind, ex.getMessage());
        }
        return ResponseEntity
            .status(status)
            .body(new ApiError(kind.name(), messageFor(kind), clientDetails(ex), Instant.now()));
    }

    /**
     * Client error - malformed body (HTTP 400).
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getClass().getSimpleName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ErrorKind.VALIDATION.name(),
                messageFor(ErrorKind.VALIDATION),
                "Request body must contain a non-blank 'query'",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ErrorKind.INTERNAL.name(),
                messageFor(ErrorKind.INTERNAL),
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case JOB_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case QUEUE_TIMEOUT, WORKER_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case WORKER_EXECUTION -> HttpStatus.BAD_GATEWAY;
            case WORKER_CRASHED -> HttpStatus.SERVICE_UNAVAILABLE;
            case JOB_STALLED, INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static String messageFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> "Invalid query";
            case JOB_NOT_FOUND -> "Job not found";
            case QUEUE_TIMEOUT -> "Query is still running";
            case WORKER_TIMEOUT -> "Query service timed out";
            case WORKER_EXECUTION -> "Query service failed to answer";
            case WORKER_CRASHED -> "Query service temporarily unavailable";
            case JOB_STALLED, INTERNAL -> "An unexpected error occurred";
        };
    }

    // Only validation and lookup failures carry caller-facing text.
    private static String clientDetails(QueryBridgeException ex) {
        return switch (ex.getKind()) {
            case VALIDATION, JOB_NOT_FOUND -> ex.getMessage();
            case QUEUE_TIMEOUT -> "The query is still being processed; check the job status later";
            case WORKER_TIMEOUT, WORKER_CRASHED, WORKER_EXECUTION -> "Please retry in a few seconds";
            case JOB_STALLED, INTERNAL -> "Please contact support with request ID";
        };
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
