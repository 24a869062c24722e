package com.teamflow.dispatch.api;

import com.teamflow.core.error.AlreadyClaimedException;
import com.teamflow.core.error.CoordinationException;
import com.teamflow.core.error.InvalidTransitionException;
import com.teamflow.core.error.NotFoundException;
import com.teamflow.core.error.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps coordination errors to JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e.getMessage(), false);
    }

    @ExceptionHandler({InvalidTransitionException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage(), false);
    }

    @ExceptionHandler({AlreadyClaimedException.class, VersionConflictException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, Object>> conflict(RuntimeException e) {
        return body(HttpStatus.CONFLICT, e.getMessage(), e instanceof CoordinationException c && c.retryable());
    }

    /** Capacity, lock timeouts, tracker failures and missing reviewers. */
    @ExceptionHandler(CoordinationException.class)
    public ResponseEntity<Map<String, Object>> unavailable(CoordinationException e) {
        log.warn("Request failed: {}", e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e.retryable());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, boolean retryable) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message == null ? status.getReasonPhrase() : message);
        body.put("retryable", retryable);
        return ResponseEntity.status(status).body(body);
    }
}
