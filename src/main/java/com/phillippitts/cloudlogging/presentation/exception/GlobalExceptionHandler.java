package com.phillippitts.cloudlogging.presentation.exception;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;

import java.util.Objects;

/**
 * Global exception handler for REST API boundary.
 *
 * Logs every failure at a severity matching its status so the request's aggregated log entry
 * carries it, then converts it to a JSON error body. The request log itself is flushed by
 * {@link com.phillippitts.cloudlogging.config.logging.RequestLoggingFilter} once the response
 * is complete.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Errors raised with an explicit status: 5xx logged as errors with the stack trace,
     * 4xx as warnings.
     */
    @ExceptionHandler(ResponseStatusException.class)
    ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        ApiError body = new ApiError(ex.getClass().getSimpleName(), detailOf(ex));
        if (status.is5xxServerError()) {
            LOG.error("Request failed with status {}", status.value(), ex);
        } else if (status.is4xxClientError()) {
            LOG.warn("{}", body);
        }
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(ex.getClass().getSimpleName(), Objects.toString(ex.getMessage(), "")));
    }

    private static String detailOf(ResponseStatusException ex) {
        if (ex.getReason() != null) {
            return ex.getReason();
        }
        HttpStatus known = HttpStatus.resolve(ex.getStatusCode().value());
        return known != null ? known.getReasonPhrase() : String.valueOf(ex.getStatusCode().value());
    }

    /**
     * Error response for API clients.
     */
    record ApiError(String error, String detail) {}
}
