package com.pingpay.scheduler.api;

import com.pingpay.scheduler.service.JobNotFoundException;
import com.pingpay.scheduler.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps service exceptions to JSON error bodies. Every body has a
 * human-readable "message".
 *
 *   ValidationException          → 400 {message, errors}
 *   unreadable / malformed JSON  → 400 {message}
 *   JobNotFoundException         → 404 {message}
 *   id that is not a UUID        → 404 {message}
 *   framework errors (404 route, 405) → their own status {message}
 *   anything else                → 500 {message, error}
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> validation(ValidationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", e.getMessage());
        body.put("errors", e.getErrors());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        log.debug("Rejected unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("message", "Malformed request body"));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(JobNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> badId(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("message", "Job not found: " + e.getValue()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> unexpected(Exception e) {
        // Framework errors (unknown route, wrong method) keep their own status.
        if (e instanceof ErrorResponse framework) {
            return ResponseEntity.status(framework.getStatusCode())
                    .body(Map.of("message", framework.getBody().getTitle() != null
                            ? framework.getBody().getTitle()
                            : "Request failed"));
        }
        log.error("Unhandled error serving request", e);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Internal server error");
        body.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
