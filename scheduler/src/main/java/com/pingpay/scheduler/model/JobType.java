package com.pingpay.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of action a job performs when it fires. Each type has one
 * {@link com.pingpay.scheduler.worker.action.JobAction} registered for it.
 */
public enum JobType {
    HTTP("http");

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static JobType fromValue(String raw) {
        for (JobType t : values()) {
            if (t.value.equalsIgnoreCase(raw)) return t;
        }
        throw new IllegalArgumentException("Unknown job type: " + raw);
    }
}
