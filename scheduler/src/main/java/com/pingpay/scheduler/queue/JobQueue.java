package com.pingpay.scheduler.queue;

import com.pingpay.scheduler.repository.FailedExecutionRepository;
import com.pingpay.scheduler.repository.QueueEntryRepository;
import com.pingpay.scheduler.schedule.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A delayed / repeating work queue over one lane of queue_entries.
 *
 * The database is the broker: entries are rows, dequeue is
 * SELECT FOR UPDATE SKIP LOCKED, and the repeat schedule is re-armed by
 * the queue itself after each run, so no polling of the jobs table is
 * needed to keep recurring jobs firing.
 *
 * Guarantees:
 *   - one row per entry id per lane (add is an upsert)
 *   - an ACTIVE row is never claimed again, so one id never runs twice in parallel
 *   - failed runs are retried with exponential backoff up to maxAttempts,
 *     then recorded in failed_executions (newest {@code failedRetention} kept)
 *
 * Two beans exist, one per {@link QueueLane} (see QueueConfig).
 */
public class JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    private final QueueLane                 lane;
    private final QueueEntryRepository      entries;
    private final FailedExecutionRepository failures;
    private final Clock                     clock;
    private final int                       maxAttempts;
    private final Duration                  backoffInitial;
    private final int                       failedRetention;

    public JobQueue(QueueLane lane,
                    QueueEntryRepository entries,
                    FailedExecutionRepository failures,
                    Clock clock,
                    int maxAttempts,
                    Duration backoffInitial,
                    int failedRetention) {
        this.lane            = lane;
        this.entries         = entries;
        this.failures        = failures;
        this.clock           = clock;
        this.maxAttempts     = maxAttempts;
        this.backoffInitial  = backoffInitial;
        this.failedRetention = failedRetention;
    }

    public QueueLane lane() {
        return lane;
    }

    // ------------------------------------------------------------------
    // Producer side
    // ------------------------------------------------------------------

    /**
     * Add an entry, or replace the definition of the entry that already
     * has this id in the lane.
     *
     * @throws IllegalArgumentException if repeat options have no future occurrence
     */
    @Transactional
    public QueueEntry add(String entryId, JobData data, QueueOptions options) {
        Instant now = clock.instant();

        Instant firstRun = null;
        if (options.repeat() != null) {
            firstRun = ScheduleCalculator.nextOccurrence(options.repeat(), now);
            if (firstRun == null) {
                throw new IllegalArgumentException("Repeat options for " + entryId + " have no next occurrence");
            }
        }

        QueueEntry entry = entries.findByLaneAndEntryId(lane, entryId)
                .orElseGet(() -> new QueueEntry(lane, entryId));
        entry.load(data);
        entry.arm(options, now, firstRun, maxAttempts);
        QueueEntry saved = entries.save(entry);

        log.info("[{}] Added entry {} (job={}, runAt={})", lane, entryId, data.jobId(), saved.getRunAt());
        return saved;
    }

    /**
     * Remove the entry with this id. Absence is not an error.
     *
     * @return true if an entry was removed
     */
    @Transactional
    public boolean remove(String entryId) {
        Optional<QueueEntry> existing = entries.findByLaneAndEntryId(lane, entryId);
        existing.ifPresent(e -> {
            entries.delete(e);
            log.info("[{}] Removed entry {}", lane, entryId);
        });
        return existing.isPresent();
    }

    @Transactional(readOnly = true)
    public boolean contains(String entryId) {
        return entries.existsByLaneAndEntryId(lane, entryId);
    }

    @Transactional(readOnly = true)
    public Optional<QueueEntry> find(String entryId) {
        return entries.findByLaneAndEntryId(lane, entryId);
    }

    @Transactional(readOnly = true)
    public List<QueueEntry> list() {
        return entries.findByLaneOrderByCreatedAtAsc(lane);
    }

    // ------------------------------------------------------------------
    // Consumer side
    // ------------------------------------------------------------------

    /**
     * Claim up to {@code limit} due entries for one dispatcher.
     * The lock is held from the SELECT until the ACTIVE flip commits.
     */
    @Transactional
    public List<QueueEntry> claimDue(String workerId, int limit) {
        if (lane == QueueLane.DEAD_LETTER || limit <= 0) return List.of();

        Instant now = clock.instant();
        List<QueueEntry> due = entries.findDueForUpdate(lane, QueueEntryState.WAITING, now, PageRequest.of(0, limit));
        for (QueueEntry entry : due) {
            entry.claim(workerId, now);
        }
        entries.saveAll(due);
        if (!due.isEmpty()) {
            log.debug("[{}] {} claimed {} entries", lane, workerId, due.size());
        }
        return due;
    }

    /**
     * The run succeeded. Repeating entries are re-armed at their next
     * occurrence; everything else is removed.
     */
    @Transactional
    public void complete(QueueEntry claimed) {
        Optional<QueueEntry> current = currentClaim(claimed);
        if (current.isEmpty()) return;

        QueueEntry entry = current.get();
        Instant now = clock.instant();
        if (entry.isRepeating()) {
            rearmAtNextOccurrence(entry, now);
        } else {
            entries.delete(entry);
            log.debug("[{}] Entry {} completed and removed", lane, entry.getEntryId());
        }
    }

    /**
     * The run failed. Retries with exponential backoff
     * ({@code backoffInitial * 2^(attempt-1)}) until maxAttempts, then
     * records a failed execution and either moves a repeating entry on to
     * its next occurrence or removes a one-shot entry.
     */
    @Transactional
    public void fail(QueueEntry claimed, String error) {
        Optional<QueueEntry> current = currentClaim(claimed);
        if (current.isEmpty()) return;

        QueueEntry entry = current.get();
        Instant now = clock.instant();
        entry.recordAttemptFailure(error);

        if (entry.getAttemptsMade() < entry.getMaxAttempts()) {
            Instant retryAt = now.plus(backoffFor(entry.getAttemptsMade()));
            entry.rearm(retryAt);
            entries.save(entry);
            log.warn("[{}] Entry {} failed (attempt {}/{}), retrying at {}. Reason: {}",
                    lane, entry.getEntryId(), entry.getAttemptsMade(), entry.getMaxAttempts(), retryAt, error);
            return;
        }

        failures.save(new FailedExecution(entry, now));
        pruneFailures();
        log.error("[{}] Entry {} failed permanently after {} attempts: {}",
                lane, entry.getEntryId(), entry.getAttemptsMade(), error);

        if (entry.isRepeating()) {
            rearmAtNextOccurrence(entry, now);
        } else {
            entries.delete(entry);
        }
    }

    /**
     * Drop a claimed entry without running it again (its job is gone or
     * inactive). A newer entry added under the same id is left alone.
     */
    @Transactional
    public void discard(QueueEntry claimed) {
        currentClaim(claimed).ifPresent(entry -> {
            entries.delete(entry);
            log.info("[{}] Discarded entry {}", lane, entry.getEntryId());
        });
    }

    /**
     * Hand back a claim that was never run. The entry is WAITING again at
     * its original run_at and no attempt is counted.
     */
    @Transactional
    public void release(QueueEntry claimed) {
        currentClaim(claimed).ifPresent(entry -> {
            entry.rearm(entry.getRunAt());
            entries.save(entry);
            log.info("[{}] Released entry {} without running it", lane, entry.getEntryId());
        });
    }

    /**
     * Return entries stuck in ACTIVE (their dispatcher died) to WAITING so
     * they are claimed again.
     *
     * @return number of entries recovered
     */
    @Transactional
    public int recoverStalled(Duration timeout) {
        Instant now = clock.instant();
        List<QueueEntry> stalled = entries.findByLaneAndStateAndLockedAtBefore(
                lane, QueueEntryState.ACTIVE, now.minus(timeout));
        for (QueueEntry entry : stalled) {
            log.warn("[{}] Recovering stalled entry {} (worker={}, claimed at {})",
                    lane, entry.getEntryId(), entry.getLockedBy(), entry.getLockedAt());
            entry.rearm(now);
        }
        entries.saveAll(stalled);
        return stalled.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    Duration backoffFor(int attempt) {
        return backoffInitial.multipliedBy(1L << Math.max(0, attempt - 1));
    }

    /**
     * Reload a claimed entry, returning it only if it is still the same
     * claim (not removed, not re-added by the lifecycle service meanwhile).
     */
    private Optional<QueueEntry> currentClaim(QueueEntry claimed) {
        Optional<QueueEntry> current = entries.findById(claimed.getId())
                .filter(e -> e.getState() == QueueEntryState.ACTIVE)
                .filter(e -> Objects.equals(e.getLockedBy(), claimed.getLockedBy()));
        if (current.isEmpty()) {
            log.debug("[{}] Entry {} was removed or replaced while running", lane, claimed.getEntryId());
        }
        return current;
    }

    private void rearmAtNextOccurrence(QueueEntry entry, Instant now) {
        Instant next = ScheduleCalculator.nextOccurrence(entry.repeat(), now);
        if (next == null) {
            log.error("[{}] Entry {} has no next occurrence, removing it", lane, entry.getEntryId());
            entries.delete(entry);
            return;
        }
        entry.resetAttempts();
        entry.rearm(next);
        entries.save(entry);
        log.debug("[{}] Entry {} re-armed for {}", lane, entry.getEntryId(), next);
    }

    private void pruneFailures() {
        List<FailedExecution> overflow = failures.findAll(
                PageRequest.of(1, failedRetention, Sort.by(Sort.Direction.DESC, "failedAt"))).getContent();
        if (!overflow.isEmpty()) {
            failures.deleteAll(overflow);
        }
    }
}
