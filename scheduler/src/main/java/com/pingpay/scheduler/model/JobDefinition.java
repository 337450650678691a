package com.pingpay.scheduler.model;

import com.pingpay.scheduler.schedule.ScheduleSpec;

import java.time.Instant;

/**
 * The caller-supplied part of a job: everything except id, run-time
 * bookkeeping and audit timestamps. Used by create and full update.
 *
 * {@code payload} is already serialized JSON (or null).
 * {@code status} may be null, meaning ACTIVE.
 */
public record JobDefinition(
        String       name,
        String       description,
        JobType      type,
        String       target,
        String       payload,
        ScheduleType scheduleType,
        String       cronExpression,
        Instant      specificTime,
        Interval     interval,
        Integer      intervalValue,
        JobStatus    status
) {
    public ScheduleSpec schedule() {
        return new ScheduleSpec(scheduleType, cronExpression, specificTime, interval, intervalValue);
    }

    public JobStatus statusOrDefault() {
        return status != null ? status : JobStatus.ACTIVE;
    }
}
