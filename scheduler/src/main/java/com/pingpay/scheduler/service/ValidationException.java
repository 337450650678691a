package com.pingpay.scheduler.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request was rejected before anything was written.
 * {@code errors} maps a field name to what is wrong with it.
 */
public class ValidationException extends RuntimeException {

    private final Map<String, String> errors;

    public ValidationException(String message, Map<String, String> errors) {
        super(message);
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static ValidationException of(String field, String problem) {
        return new ValidationException("Invalid job data", Map.of(field, problem));
    }

    public Map<String, String> getErrors() {
        return errors;
    }
}
