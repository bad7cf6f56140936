package com.phillippitts.callagent.presentation.exception;

import com.phillippitts.callagent.exception.CallAgentException;
import com.phillippitts.callagent.exception.ProfileNotFoundException;
import com.phillippitts.callagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown client number (HTTP 404).
     */
    @ExceptionHandler(ProfileNotFoundException.class)
    ResponseEntity<ApiError> handleProfileNotFound(ProfileNotFoundException ex) {
        LOG.warn("No profile for number {}", LogSanitizer.maskNumber(ex.getPhoneNumber(), 4));
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Client profile not found",
                "No client is configured for that number",
                Instant.now()
            ));
    }

    /**
     * Engine failure surfaced over HTTP - retry possible (HTTP 503).
     */
    @ExceptionHandler(CallAgentException.class)
    ResponseEntity<ApiError> handleEngineFailure(CallAgentException ex) {
        LOG.error("Call engine error", ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Call engine temporarily unavailable",
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
                "Please contact support with request ID",
                Instant.now()
            ));
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
