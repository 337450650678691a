package com.pingpay.scheduler.service;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.queue.JobData;
import com.pingpay.scheduler.queue.JobQueue;
import com.pingpay.scheduler.queue.QueueEntry;
import com.pingpay.scheduler.queue.QueueEntryState;
import com.pingpay.scheduler.queue.QueueOptions;
import com.pingpay.scheduler.queue.QueueReconciliationException;
import com.pingpay.scheduler.schedule.RepeatOptions;
import com.pingpay.scheduler.schedule.ScheduleCalculator;
import com.pingpay.scheduler.schedule.ScheduleSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps the two queue lanes in line with a job row that has already been
 * written. The job id is the entry id in both lanes.
 *
 * Every transition removes before it adds, so after any call the id is in
 * at most one lane. Lane failures here happen after the store mutation has
 * committed: they are logged as {@link QueueReconciliationException} and
 * not re-thrown, leaving the row authoritative until the next reconcile.
 */
@Component
public class JobQueueCoordinator {

    private static final Logger log = LoggerFactory.getLogger(JobQueueCoordinator.class);

    private final JobQueue executionQueue;
    private final JobQueue deadLetterQueue;
    private final Clock    clock;

    public JobQueueCoordinator(@Qualifier("executionQueue") JobQueue executionQueue,
                               @Qualifier("deadLetterQueue") JobQueue deadLetterQueue,
                               Clock clock) {
        this.executionQueue  = executionQueue;
        this.deadLetterQueue = deadLetterQueue;
        this.clock           = clock;
    }

    /**
     * Remove the job from both lanes, then schedule it in the execution
     * lane from its stored schedule fields.
     *
     * @return false if the schedule has no future run (nothing was added)
     */
    public boolean arm(Job job) {
        String id = entryId(job.getId());
        try {
            executionQueue.remove(id);
            deadLetterQueue.remove(id);

            QueueOptions options = optionsFor(job.schedule(), clock.instant());
            if (options == null) {
                log.warn("Job {} has no future run, not adding it to the execution queue", job.getId());
                return false;
            }
            executionQueue.add(id, JobData.of(job), options);
            return true;
        } catch (RuntimeException e) {
            reportDrift("arm", job.getId(), e);
            return false;
        }
    }

    /** Remove the job from the execution lane and park it in the dead-letter lane. */
    public void park(Job job) {
        String id = entryId(job.getId());
        try {
            executionQueue.remove(id);
            deadLetterQueue.add(id, JobData.of(job), QueueOptions.parkedEntry());
        } catch (RuntimeException e) {
            reportDrift("park", job.getId(), e);
        }
    }

    /**
     * Remove the job from both lanes. Absence in either lane is fine, and a
     * failure in one lane does not stop the removal from the other.
     */
    public void disarm(UUID jobId) {
        String id = entryId(jobId);
        try {
            executionQueue.remove(id);
        } catch (RuntimeException e) {
            reportDrift("disarm (execution lane)", jobId, e);
        }
        try {
            deadLetterQueue.remove(id);
        } catch (RuntimeException e) {
            reportDrift("disarm (dead-letter lane)", jobId, e);
        }
    }

    public void removeFromDeadLetter(UUID jobId) {
        try {
            deadLetterQueue.remove(entryId(jobId));
        } catch (RuntimeException e) {
            reportDrift("remove from dead-letter", jobId, e);
        }
    }

    /**
     * Queue a single immediate run under its own entry id, so it can run
     * next to the scheduled entry. Unlike the lane upkeep above, a failure
     * here is the caller's failure and propagates.
     *
     * @return the entry id of the manual run
     */
    public String trigger(Job job) {
        String id = job.getId() + "-manual-" + clock.millis();
        executionQueue.add(id, JobData.of(job), QueueOptions.immediate());
        log.info("Queued manual run {} for job {}", id, job.getId());
        return id;
    }

    public boolean inExecutionLane(UUID jobId) {
        return executionQueue.contains(entryId(jobId));
    }

    public boolean inDeadLetterLane(UUID jobId) {
        return deadLetterQueue.contains(entryId(jobId));
    }

    /**
     * Remove entries, in either lane, whose job row no longer exists.
     * Entries being run right now are left to the worker, which skips them.
     *
     * @return number of entries removed
     */
    public int removeOrphans(Set<UUID> knownJobIds) {
        int removed = 0;
        for (JobQueue lane : List.of(executionQueue, deadLetterQueue)) {
            for (QueueEntry entry : lane.list()) {
                if (entry.getState() == QueueEntryState.ACTIVE || knownJobIds.contains(entry.getJobId())) {
                    continue;
                }
                if (lane.remove(entry.getEntryId())) {
                    log.warn("Removed orphan entry {} from {} (job {} no longer exists)",
                            entry.getEntryId(), lane.lane(), entry.getJobId());
                    removed++;
                }
            }
        }
        return removed;
    }

    /**
     * Delay (SPECIFIC_TIME) or repeat (CRON / RECURRING) options for a
     * schedule, or null when it cannot be armed as of {@code now}.
     */
    static QueueOptions optionsFor(ScheduleSpec spec, Instant now) {
        if (spec == null || spec.type() == null) return null;
        return switch (spec.type()) {
            case SPECIFIC_TIME -> {
                Long delay = ScheduleCalculator.calculateInitialDelay(spec, now);
                yield delay != null ? QueueOptions.delayed(delay) : null;
            }
            case CRON, RECURRING -> {
                RepeatOptions repeat = ScheduleCalculator.calculateRepeatOptions(spec);
                yield repeat != null ? QueueOptions.repeating(repeat) : null;
            }
        };
    }

    private static String entryId(UUID jobId) {
        return jobId.toString();
    }

    private void reportDrift(String operation, UUID jobId, RuntimeException cause) {
        QueueReconciliationException drift = new QueueReconciliationException(
                "Queue " + operation + " failed for job " + jobId + "; lanes may not match the job row", cause);
        log.error(drift.getMessage(), drift);
    }
}
