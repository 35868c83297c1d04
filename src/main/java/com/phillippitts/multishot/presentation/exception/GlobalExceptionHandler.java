package com.phillippitts.multishot.presentation.exception;

import com.phillippitts.multishot.exception.EngineConfigurationException;
import com.phillippitts.multishot.exception.GateTimeoutException;
import com.phillippitts.multishot.exception.InvalidPromptException;
import com.phillippitts.multishot.exception.RunAbortedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping internal details out of 5xx bodies.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - rejected run request (HTTP 400).
     */
    @ExceptionHandler(InvalidPromptException.class)
    ResponseEntity<ApiError> handleInvalidPrompt(InvalidPromptException ex) {
        LOG.warn("Invalid run request: {}", ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid run request",
                ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Client error - request body failed validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
            .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "ValidationError",
                "Invalid run request",
                details,
                Instant.now()
            ));
    }

    /**
     * Client error - requested engine cannot be configured (HTTP 400).
     */
    @ExceptionHandler(EngineConfigurationException.class)
    ResponseEntity<ApiError> handleEngineConfiguration(EngineConfigurationException ex) {
        LOG.warn("Engine configuration rejected: engine={}", ex.getEngineName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid engine configuration",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Upstream failure in fail-fast mode (HTTP 502).
     */
    @ExceptionHandler(RunAbortedException.class)
    ResponseEntity<ApiError> handleRunAborted(RunAbortedException ex) {
        LOG.error("Run aborted: engine={}, error={}, partialResults={}",
            ex.getEngineName(), ex.getEngineError(), ex.getPartialResults().size());
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Run aborted after an engine failure",
                "Engine " + ex.getEngineName() + " failed; retry or enable continue-on-error",
                Instant.now()
            ));
    }

    /**
     * Transient overload - retry possible (HTTP 503).
     */
    @ExceptionHandler(GateTimeoutException.class)
    ResponseEntity<ApiError> handleGateTimeout(GateTimeoutException ex) {
        LOG.warn("Concurrency gate timeout after {}ms", ex.getTimeoutMs());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service busy",
                "Please retry in a few seconds",
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
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with the run ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
