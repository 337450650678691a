package com.pingpay.scheduler.schedule;

import com.pingpay.scheduler.model.Interval;
import com.pingpay.scheduler.model.ScheduleType;

import java.time.Instant;

/**
 * The schedule fields of a job, detached from the entity so the
 * calculator can work on requests, stored rows and queue entries alike.
 *
 * Exactly one of {cronExpression, specificTime, (interval + intervalValue)}
 * is meaningful, selected by {@code type}.
 */
public record ScheduleSpec(
        ScheduleType type,
        String       cronExpression,
        Instant      specificTime,
        Interval     interval,
        Integer      intervalValue
) {
    public static ScheduleSpec cron(String expression) {
        return new ScheduleSpec(ScheduleType.CRON, expression, null, null, null);
    }

    public static ScheduleSpec at(Instant specificTime) {
        return new ScheduleSpec(ScheduleType.SPECIFIC_TIME, null, specificTime, null, null);
    }

    public static ScheduleSpec every(int value, Interval interval) {
        return new ScheduleSpec(ScheduleType.RECURRING, null, null, interval, value);
    }
}
