package com.pingpay.scheduler.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.pingpay.scheduler.model.Interval;
import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobStatus;
import com.pingpay.scheduler.model.JobType;
import com.pingpay.scheduler.model.ScheduleType;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for every endpoint that returns a job.
 * {@code payload} is the stored JSON, emitted as-is.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResponse(
        UUID         id,
        String       name,
        String       description,
        JobType      type,
        String       target,
        @JsonRawValue String payload,
        ScheduleType scheduleType,
        String       cronExpression,
        Instant      specificTime,
        Interval     interval,
        Integer      intervalValue,
        JobStatus    status,
        Instant      lastRun,
        Instant      nextRun,
        String       errorMessage,
        Instant      createdAt,
        Instant      updatedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getName(),
                job.getDescription(),
                job.getType(),
                job.getTarget(),
                job.getPayload(),
                job.getScheduleType(),
                job.getCronExpression(),
                job.getSpecificTime(),
                job.getInterval(),
                job.getIntervalValue(),
                job.getStatus(),
                job.getLastRun(),
                job.getNextRun(),
                job.getErrorMessage(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
