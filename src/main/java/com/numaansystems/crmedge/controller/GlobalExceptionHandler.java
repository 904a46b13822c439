package com.numaansystems.crmedge.controller;

import com.numaansystems.crmedge.resilience.CircuitOpenException;
import com.numaansystems.crmedge.resilience.EdgeException;
import com.numaansystems.crmedge.resilience.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders failures as {@code {"error", "code", "message"}} JSON.
 *
 * <p>{@code error} is the HTTP reason phrase, {@code code} the {@link ErrorKind} and
 * {@code message} the kind's user-facing text. Exception messages and stack traces
 * stay in the logs.</p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(EdgeException.class)
    public ResponseEntity<Map<String, Object>> handleEdgeException(EdgeException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            logger.error("Request failed with {}: {}", ex.getKind(), ex.getMessage());
        } else {
            logger.warn("Request rejected with {}: {}", ex.getKind(), ex.getMessage());
        }
        return errorResponse(status, ex.getKind());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        logger.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION);
    }

    /**
     * Fallback for everything else. Spring MVC exceptions keep their status (405, 415 and
     * the like); any other failure is a 500 {@link ErrorKind#UNKNOWN}.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatus status = HttpStatus.resolve(errorResponse.getStatusCode().value());
            if (status != null && !status.is5xxServerError()) {
                logger.warn("Request rejected with HTTP {}: {}", status.value(), ex.getMessage());
                return errorResponse(status, ErrorKind.fromStatus(status.value()));
            }
        }
        logger.error("Unexpected error processing request", ex);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.UNKNOWN);
    }

    static ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, ErrorKind kind) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("code", kind.name());
        body.put("message", kind.getUserMessage());
        return ResponseEntity.status(status).body(body);
    }

    static HttpStatus statusFor(EdgeException ex) {
        if (ex instanceof CircuitOpenException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return switch (ex.getKind()) {
            case VALIDATION, INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case UNAUTHORIZED, SESSION_EXPIRED -> HttpStatus.UNAUTHORIZED;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case NETWORK, TIMEOUT, OFFLINE, UPSTREAM -> HttpStatus.BAD_GATEWAY;
            case STATE, UNKNOWN -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
