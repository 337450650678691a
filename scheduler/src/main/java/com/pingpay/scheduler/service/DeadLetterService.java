package com.pingpay.scheduler.service;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobStatus;
import com.pingpay.scheduler.queue.FailedExecution;
import com.pingpay.scheduler.repository.FailedExecutionRepository;
import com.pingpay.scheduler.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Operator view of the dead-letter lane: inactive jobs waiting to be
 * reactivated or acknowledged, plus the record of executions that ran
 * out of retries.
 */
@Service
public class DeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterService.class);

    private final JobService                jobService;
    private final JobRepository             jobRepo;
    private final FailedExecutionRepository failures;
    private final JobQueueCoordinator       queues;
    private final Clock                     clock;

    public DeadLetterService(JobService jobService,
                             JobRepository jobRepo,
                             FailedExecutionRepository failures,
                             JobQueueCoordinator queues,
                             Clock clock) {
        this.jobService = jobService;
        this.jobRepo    = jobRepo;
        this.failures   = failures;
        this.queues     = queues;
        this.clock      = clock;
    }

    /** Dead-lettered jobs, most recently parked first. */
    @Transactional(readOnly = true)
    public List<Job> list() {
        return jobRepo.findByStatusOrderByUpdatedAtDesc(JobStatus.INACTIVE);
    }

    /**
     * INACTIVE → ACTIVE: out of the dead-letter lane, re-armed from the
     * stored schedule.
     */
    public Job reactivate(UUID id) {
        Job job = jobService.get(id);
        requireInactive(job, "Only inactive jobs can be reactivated");
        Job reactivated = jobService.setStatus(id, JobStatus.ACTIVE);
        log.info("Reactivated job {} from dead-letter", id);
        return reactivated;
    }

    /**
     * Acknowledge a dead-lettered job without re-arming it: last_run = now,
     * next_run and error cleared, status stays INACTIVE.
     */
    public Job complete(UUID id) {
        Job job = jobService.get(id);
        requireInactive(job, "Only inactive jobs can be completed from DLQ");

        job.setLastRun(clock.instant());
        job.setNextRun(null);
        job.setErrorMessage(null);
        job = jobRepo.save(job);
        log.info("Completed job {} from dead-letter", id);

        queues.removeFromDeadLetter(id);
        return job;
    }

    /** Executions that exhausted their retries, newest first. */
    @Transactional(readOnly = true)
    public List<FailedExecution> failedExecutions() {
        return failures.findAllByOrderByFailedAtDesc();
    }

    private static void requireInactive(Job job, String message) {
        if (job.getStatus() != JobStatus.INACTIVE) {
            throw new ValidationException(message,
                    Map.of("status", "Job is " + job.getStatus().value()));
        }
    }
}
