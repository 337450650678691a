package com.pingpay.scheduler.service;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobDefinition;
import com.pingpay.scheduler.model.JobStatus;
import com.pingpay.scheduler.model.ScheduleType;
import com.pingpay.scheduler.repository.JobRepository;
import com.pingpay.scheduler.schedule.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Job lifecycle: the only writer of the jobs table outside the worker.
 *
 * Every mutation writes the row first (its own transaction, committed by
 * the repository) and then brings the queue lanes in line through
 * {@link JobQueueCoordinator}. The methods are deliberately not wrapped
 * in one transaction: a lane failure must not roll back the row.
 *
 * Concurrent edits of the same id are not serialized here; callers apply
 * them one at a time.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository       jobRepo;
    private final JobQueueCoordinator queues;
    private final Clock               clock;

    public JobService(JobRepository jobRepo, JobQueueCoordinator queues, Clock clock) {
        this.jobRepo = jobRepo;
        this.queues  = queues;
        this.clock   = clock;
    }

    // ------------------------------------------------------------------
    // Create / read
    // ------------------------------------------------------------------

    /**
     * Validate, persist and schedule a new job.
     *
     *  1. Check the definition (schedule fields consistent, time in the future)
     *  2. Compute next_run and insert the row (status defaults to ACTIVE)
     *  3. ACTIVE → execution lane under the job id; INACTIVE → dead-letter lane
     */
    public Job create(JobDefinition definition) {
        Instant now = clock.instant();
        JobValidator.validate(definition, now);

        Job job = new Job(definition);
        job.setNextRun(ScheduleCalculator.calculateNextRun(job.schedule(), now));
        job = jobRepo.save(job);
        log.info("Created job {} ({}, {})", job.getId(), job.getName(), job.getScheduleType());

        placeInLane(job);
        return job;
    }

    @Transactional(readOnly = true)
    public Optional<Job> findById(UUID id) {
        return jobRepo.findById(id);
    }

    /**
     * @throws JobNotFoundException if no row has this id
     */
    @Transactional(readOnly = true)
    public Job get(UUID id) {
        return jobRepo.findById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    /** All jobs, newest first, optionally only those with the given status. */
    @Transactional(readOnly = true)
    public List<Job> list(JobStatus status) {
        return status == null
                ? jobRepo.findAllByOrderByCreatedAtDesc()
                : jobRepo.findByStatusOrderByCreatedAtDesc(status);
    }

    // ------------------------------------------------------------------
    // Mutations
    // ------------------------------------------------------------------

    /**
     * Replace a job's definition. The id is removed from both lanes before
     * it is re-added, so no fire from the old schedule survives the edit.
     * A definition without a status keeps the current one.
     */
    public Job update(UUID id, JobDefinition definition) {
        Job job = get(id);
        Instant now = clock.instant();
        JobValidator.validate(definition, now);

        JobStatus previous = job.getStatus();
        job.apply(definition);
        if (definition.status() == null) {
            job.setStatus(previous);
        }
        job.setNextRun(ScheduleCalculator.calculateNextRun(job.schedule(), now));
        job = jobRepo.save(job);
        log.info("Updated job {} (status={})", job.getId(), job.getStatus());

        queues.disarm(job.getId());
        placeInLane(job);
        return job;
    }

    /** Delete the row and drop the id from both lanes. */
    public void delete(UUID id) {
        Job job = get(id);
        jobRepo.delete(job);
        log.info("Deleted job {}", id);
        queues.disarm(id);
    }

    /**
     * Move a job between ACTIVE and INACTIVE.
     *
     * INACTIVE: out of the execution lane, parked in the dead-letter lane.
     * ACTIVE:   out of the dead-letter lane, re-armed from the stored schedule.
     *
     * @throws ValidationException for any other target status, or when an
     *         ACTIVE job would have no future run
     */
    public Job setStatus(UUID id, JobStatus status) {
        if (status != JobStatus.ACTIVE && status != JobStatus.INACTIVE) {
            throw new ValidationException("Invalid status value",
                    Map.of("status", "Status must be one of: active, inactive"));
        }

        Job job = get(id);
        if (status == JobStatus.ACTIVE) {
            job.setNextRun(requireNextRun(job));
        }
        JobStatus previous = job.getStatus();
        job.setStatus(status);
        job = jobRepo.save(job);
        log.info("Job {} status {} → {}", id, previous, status);

        placeInLane(job);
        return job;
    }

    /**
     * Queue one immediate run next to the regular schedule. next_run and
     * the schedule are untouched.
     *
     * @return the entry id of the manual run
     */
    public String runNow(UUID id) {
        Job job = get(id);
        return queues.trigger(job);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Next run for a job about to be (re-)armed.
     *
     * @throws ValidationException if the stored schedule has no future run
     */
    Instant requireNextRun(Job job) {
        Instant next = ScheduleCalculator.calculateNextRun(job.schedule(), clock.instant());
        if (next == null) {
            throw job.getScheduleType() == ScheduleType.SPECIFIC_TIME
                    ? ValidationException.of("specific_time", "Specific time must be in the future")
                    : ValidationException.of("schedule_type", "Invalid repeat configuration");
        }
        return next;
    }

    private void placeInLane(Job job) {
        if (job.getStatus() == JobStatus.INACTIVE) {
            queues.park(job);
        } else {
            queues.arm(job);
        }
    }
}
