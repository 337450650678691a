package com.pingpay.scheduler.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.pingpay.scheduler.queue.FailedExecution;

import java.time.Instant;
import java.util.UUID;

/** One entry of GET /dlq/failed. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FailedExecutionResponse(
        UUID    id,
        String  entryId,
        UUID    jobId,
        String  name,
        int     attempts,
        String  error,
        Instant failedAt
) {
    public static FailedExecutionResponse from(FailedExecution f) {
        return new FailedExecutionResponse(
                f.getId(), f.getEntryId(), f.getJobId(), f.getName(),
                f.getAttempts(), f.getError(), f.getFailedAt());
    }
}
