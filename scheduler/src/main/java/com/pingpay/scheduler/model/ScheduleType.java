package com.pingpay.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a job's run times are derived.
 *
 * CRON          - cron_expression, evaluated in UTC
 * SPECIFIC_TIME - a single run at specific_time
 * RECURRING     - every interval_value units of interval
 */
public enum ScheduleType {
    CRON("cron"),
    SPECIFIC_TIME("specific_time"),
    RECURRING("recurring");

    private final String value;

    ScheduleType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ScheduleType fromValue(String raw) {
        for (ScheduleType t : values()) {
            if (t.value.equalsIgnoreCase(raw)) return t;
        }
        throw new IllegalArgumentException("Unknown schedule type: " + raw);
    }
}
