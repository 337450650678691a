package com.pingpay.scheduler.queue;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobType;

import java.util.UUID;

/**
 * Snapshot of a job carried by a queue entry. May be stale compared to
 * the jobs row; the worker always re-reads the row before acting.
 */
public record JobData(UUID jobId, String name, JobType type, String target, String payload) {

    public static JobData of(Job job) {
        return new JobData(job.getId(), job.getName(), job.getType(), job.getTarget(), job.getPayload());
    }
}
