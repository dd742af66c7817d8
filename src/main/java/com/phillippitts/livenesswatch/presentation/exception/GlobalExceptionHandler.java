package com.phillippitts.livenesswatch.presentation.exception;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts invalid trigger input to 400 responses and anything unexpected to 500.
 * Logs errors for monitoring while keeping stack traces away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - trigger parameters failed validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidArguments(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        LOG.warn("Invalid watchdog trigger: {}", details);
        return badRequest(ex, "Invalid watchdog parameters", details);
    }

    /**
     * Client error - plain-text trigger failed validation (HTTP 400).
     */
    @ExceptionHandler(ConstraintViolationException.class)
    ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException ex) {
        String details = ex.getConstraintViolations().stream()
                .map(GlobalExceptionHandler::describeViolation)
                .sorted()
                .collect(Collectors.joining("; "));
        LOG.warn("Invalid watchdog trigger: {}", details);
        return badRequest(ex, "Invalid watchdog parameters", details);
    }

    /**
     * Client error - body is not valid JSON or has wrong field types (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable watchdog trigger: {}", ex.getMostSpecificCause().getMessage());
        return badRequest(ex, "Malformed request body", "Expected JSON with optional timeoutMs and info");
    }

    /**
     * Client error - value rejected by the watchdog itself (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Rejected watchdog trigger: {}", ex.getMessage());
        return badRequest(ex, "Invalid watchdog parameters", ex.getMessage());
    }

    /**
     * Catch-all. Spring MVC errors keep their own status (unsupported media type, unknown
     * method); anything else is unexpected (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            LOG.warn("Request rejected: {}", ex.getMessage());
            return ResponseEntity
                .status(errorResponse.getStatusCode())
                .body(new ApiError(
                    ex.getClass().getSimpleName(),
                    "Request rejected",
                    ex.getMessage(),
                    Instant.now()
                ));
        }
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "See server logs for details",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(Exception ex, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private static String describeViolation(ConstraintViolation<?> violation) {
        return violation.getPropertyPath() + ": " + violation.getMessage();
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
