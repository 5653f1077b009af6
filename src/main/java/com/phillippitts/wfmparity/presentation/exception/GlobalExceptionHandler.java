package com.phillippitts.wfmparity.presentation.exception;

import com.phillippitts.wfmparity.exception.FailurePatternNotFoundException;
import com.phillippitts.wfmparity.exception.IllegalJobTransitionException;
import com.phillippitts.wfmparity.exception.InvalidJobInputException;
import com.phillippitts.wfmparity.exception.JobNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

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
     * Client error - submission rejected (HTTP 400).
     */
    @ExceptionHandler(InvalidJobInputException.class)
    ResponseEntity<ApiError> handleInvalidJobInput(InvalidJobInputException ex) {
        LOG.warn("Invalid job input: {}", ex.getViolations());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid job input", String.join("; ", ex.getViolations()));
    }

    /**
     * Client error - request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
    }

    /**
     * Client error - unreadable body, missing or malformed parameter (HTTP 400).
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        String details = ex instanceof HttpMessageNotReadableException
                ? "Request body is missing or not valid JSON"
                : ex.getMessage();
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
    }

    @ExceptionHandler(JobNotFoundException.class)
    ResponseEntity<ApiError> handleJobNotFound(JobNotFoundException ex) {
        LOG.debug("Job not found: {}", ex.getJobId());
        return error(HttpStatus.NOT_FOUND, ex, "Job not found", ex.getMessage());
    }

    @ExceptionHandler(FailurePatternNotFoundException.class)
    ResponseEntity<ApiError> handlePatternNotFound(FailurePatternNotFoundException ex) {
        LOG.debug("Failure pattern not found: {}", ex.getPatternId());
        return error(HttpStatus.NOT_FOUND, ex, "Failure pattern not found", ex.getMessage());
    }

    /**
     * Lifecycle guard tripped (HTTP 409).
     */
    @ExceptionHandler(IllegalJobTransitionException.class)
    ResponseEntity<ApiError> handleIllegalTransition(IllegalJobTransitionException ex) {
        LOG.warn("Illegal transition for job {}: {} -> {}", ex.getJobId(), ex.getFrom(), ex.getTo());
        return error(HttpStatus.CONFLICT, ex, "Job state conflict", ex.getMessage());
    }

    /**
     * Transient error - database unavailable, retry possible (HTTP 503).
     */
    @ExceptionHandler(DataAccessException.class)
    ResponseEntity<ApiError> handleDataAccess(DataAccessException ex) {
        LOG.error("Data access failure", ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Storage temporarily unavailable",
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

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
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
