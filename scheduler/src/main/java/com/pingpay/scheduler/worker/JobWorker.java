package com.pingpay.scheduler.worker;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobStatus;
import com.pingpay.scheduler.model.ScheduleType;
import com.pingpay.scheduler.queue.QueueEntry;
import com.pingpay.scheduler.repository.JobRepository;
import com.pingpay.scheduler.schedule.ScheduleCalculator;
import com.pingpay.scheduler.worker.action.JobActionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Runs one dequeued execution entry against the authoritative job row.
 *
 *   1. Re-read the job by id; the entry's snapshot may be stale.
 *   2. Row missing  → skip (deleted after the entry was queued).
 *   3. Row INACTIVE → skip (status changed after the entry was queued).
 *   4. Perform the action for the job's type.
 *   5. Success → last_run = now, next_run recomputed (none for SPECIFIC_TIME),
 *                error cleared. Status is left as it is: a FAILED job stays
 *                FAILED until it is switched back explicitly.
 *   6. Failure → error_message + FAILED, then re-throw so the queue retries.
 *
 * Manual runs only touch last_run / error_message; the job's schedule and
 * next_run belong to its scheduled entry.
 *
 * There is a narrow window between step 1 and the action in which a status
 * change is not seen. Steps 2-3 reduce it, they do not close it.
 */
@Component
public class JobWorker {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final JobRepository     jobRepo;
    private final JobActionRegistry actions;
    private final Clock             clock;

    public JobWorker(JobRepository jobRepo, JobActionRegistry actions, Clock clock) {
        this.jobRepo = jobRepo;
        this.actions = actions;
        this.clock   = clock;
    }

    public WorkerOutcome process(QueueEntry entry) {
        MDC.put("jobId", String.valueOf(entry.getJobId()));
        try {
            log.info("Running job {} of type {} (entry {})",
                    entry.getJobId(), entry.getType(), entry.getEntryId());

            Optional<Job> row = jobRepo.findById(entry.getJobId());
            if (row.isEmpty()) {
                log.warn("Job {} not found in database, skipping execution", entry.getJobId());
                return WorkerOutcome.SKIPPED_MISSING;
            }

            Job job = row.get();
            if (job.getStatus() == JobStatus.INACTIVE) {
                log.info("Job {} is inactive, skipping execution", job.getId());
                return WorkerOutcome.SKIPPED_INACTIVE;
            }

            try {
                actions.execute(job);
            } catch (RuntimeException e) {
                recordFailure(job, e);
                throw e;
            }

            recordSuccess(job, entry.isManualRun());
            log.info("Job {} completed successfully", job.getId());
            return WorkerOutcome.EXECUTED;
        } finally {
            MDC.remove("jobId");
        }
    }

    private void recordSuccess(Job job, boolean manualRun) {
        Instant now = clock.instant();
        if (manualRun) {
            jobRepo.recordManualSuccess(job.getId(), now);
        } else {
            Instant nextRun = job.getScheduleType() == ScheduleType.SPECIFIC_TIME
                    ? null
                    : ScheduleCalculator.calculateNextRun(job.schedule(), now);
            jobRepo.recordSuccess(job.getId(), now, nextRun);
        }
    }

    private void recordFailure(Job job, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.error("Error running job {}: {}", job.getId(), message);
        jobRepo.recordFailure(job.getId(), message, clock.instant());
    }
}
