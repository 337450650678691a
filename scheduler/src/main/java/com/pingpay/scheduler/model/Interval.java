package com.pingpay.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.temporal.ChronoUnit;

/**
 * Base unit of a RECURRING schedule. Month and year steps are calendar-aware.
 */
public enum Interval {
    MINUTE("minute", ChronoUnit.MINUTES),
    HOUR("hour", ChronoUnit.HOURS),
    DAY("day", ChronoUnit.DAYS),
    WEEK("week", ChronoUnit.WEEKS),
    MONTH("month", ChronoUnit.MONTHS),
    YEAR("year", ChronoUnit.YEARS);

    private final String value;
    private final ChronoUnit unit;

    Interval(String value, ChronoUnit unit) {
        this.value = value;
        this.unit  = unit;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public ChronoUnit unit() {
        return unit;
    }

    @JsonCreator
    public static Interval fromValue(String raw) {
        for (Interval i : values()) {
            if (i.value.equalsIgnoreCase(raw)) return i;
        }
        throw new IllegalArgumentException("Unknown interval: " + raw);
    }
}
