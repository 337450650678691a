package com.pingpay.scheduler.model;

import java.lang.reflect.Field;
import java.time.Instant;
import java.util.UUID;

/**
 * Builders for jobs in tests. The JPA id is normally generated on save,
 * so it is set by reflection here.
 */
public final class JobFixtures {

    public static final String TARGET = "https://merchant.example/charge";

    private JobFixtures() {}

    public static JobDefinition recurring(int value, Interval interval) {
        return new JobDefinition("recurring-job", null, JobType.HTTP, TARGET, "{\"plan\":\"pro\"}",
                ScheduleType.RECURRING, null, null, interval, value, null);
    }

    public static JobDefinition cron(String expression) {
        return new JobDefinition("cron-job", null, JobType.HTTP, TARGET, null,
                ScheduleType.CRON, expression, null, null, null, null);
    }

    public static JobDefinition at(Instant specificTime) {
        return new JobDefinition("one-shot-job", null, JobType.HTTP, TARGET, null,
                ScheduleType.SPECIFIC_TIME, null, specificTime, null, null, null);
    }

    public static JobDefinition withStatus(JobDefinition d, JobStatus status) {
        return new JobDefinition(d.name(), d.description(), d.type(), d.target(), d.payload(),
                d.scheduleType(), d.cronExpression(), d.specificTime(), d.interval(), d.intervalValue(), status);
    }

    public static Job job(JobDefinition definition) {
        return job(definition, UUID.randomUUID());
    }

    public static Job job(JobDefinition definition, UUID id) {
        return assignId(new Job(definition), id);
    }

    /** What a save does to a new row. */
    public static Job assignId(Job job, UUID id) {
        try {
            Field f = Job.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(job, id);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(e);
        }
        return job;
    }
}
