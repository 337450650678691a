package com.pingpay.scheduler.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.pingpay.scheduler.model.Interval;
import com.pingpay.scheduler.model.JobDefinition;
import com.pingpay.scheduler.model.JobStatus;
import com.pingpay.scheduler.model.JobType;
import com.pingpay.scheduler.model.ScheduleType;

import java.time.Instant;

/**
 * Request body for POST /jobs and PUT /jobs/{id}.
 *
 * Example:
 *   {"name":"daily-charge","type":"http","target":"https://merchant.example/charge",
 *    "payload":{"plan":"pro"},"schedule_type":"recurring","interval":"day","interval_value":1}
 *
 * Shape checks beyond JSON parsing happen in JobValidator.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobRequest(
        String       name,
        String       description,
        JobType      type,
        String       target,
        JsonNode     payload,
        ScheduleType scheduleType,
        String       cronExpression,
        Instant      specificTime,
        Interval     interval,
        Integer      intervalValue,
        JobStatus    status
) {
    public JobDefinition toDefinition() {
        String body = payload == null || payload.isNull() ? null : payload.toString();
        return new JobDefinition(name, description, type, target, body,
                scheduleType, cronExpression, specificTime, interval, intervalValue, status);
    }
}
