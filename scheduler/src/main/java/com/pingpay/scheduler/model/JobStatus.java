package com.pingpay.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Runtime status of a scheduled job.
 *
 * Transitions:
 *   ACTIVE   → INACTIVE (PATCH status; job moves to the dead-letter lane)
 *   INACTIVE → ACTIVE   (PATCH status or dead-letter reactivate)
 *   ACTIVE   → FAILED   (worker run failed; job stays in the execution lane and is retried)
 *   FAILED   → ACTIVE   (a later run succeeded)
 */
public enum JobStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static JobStatus fromValue(String raw) {
        for (JobStatus s : values()) {
            if (s.value.equalsIgnoreCase(raw)) return s;
        }
        throw new IllegalArgumentException("Unknown job status: " + raw);
    }
}
