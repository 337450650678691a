package com.pingpay.scheduler.worker;

import com.pingpay.scheduler.queue.JobQueue;
import com.pingpay.scheduler.queue.QueueEntry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background loop that feeds due execution-lane entries to the worker pool.
 *
 * Each tick claims at most as many entries as there are idle workers, so
 * nothing sits claimed-but-unstarted while the pool is busy. The fixed
 * pool is the concurrency ceiling (scheduler.worker.concurrency, default 5).
 *
 * Outcome handling:
 *   EXECUTED                        → queue.complete (repeat re-armed / one-shot removed)
 *   SKIPPED_MISSING / _INACTIVE     → queue.discard
 *   exception                       → queue.fail (retry with backoff)
 */
@Component
@EnableScheduling
public class QueueDispatcher {

    private static final Logger log = LoggerFactory.getLogger(QueueDispatcher.class);

    private final JobQueue        executionQueue;
    private final JobWorker       worker;
    private final int             concurrency;
    private final Duration        stallTimeout;
    private final ExecutorService workers;
    private final AtomicInteger   inFlight = new AtomicInteger();

    public QueueDispatcher(@Qualifier("executionQueue") JobQueue executionQueue,
                           JobWorker worker,
                           @Value("${scheduler.worker.concurrency:5}") int concurrency,
                           @Value("${scheduler.worker.stall-timeout:5m}") Duration stallTimeout) {
        this.executionQueue = executionQueue;
        this.worker         = worker;
        this.concurrency    = concurrency;
        this.stallTimeout   = stallTimeout;
        this.workers        = Executors.newFixedThreadPool(concurrency);
    }

    /**
     * Claim due entries for the idle workers and dispatch them.
     */
    @Scheduled(fixedDelayString = "${scheduler.worker.poll-interval-ms:1000}")
    public void tick() {
        int idle = concurrency - inFlight.get();
        if (idle <= 0) return;

        String workerId = "dispatcher-" + UUID.randomUUID().toString().substring(0, 8);
        List<QueueEntry> claimed;
        try {
            claimed = executionQueue.claimDue(workerId, idle);
        } catch (Exception e) {
            log.error("Failed to claim due entries: {}", e.getMessage(), e);
            return;
        }

        for (QueueEntry entry : claimed) {
            inFlight.incrementAndGet();
            try {
                workers.submit(() -> {
                    try {
                        dispatch(entry);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                });
            } catch (RejectedExecutionException e) {
                inFlight.decrementAndGet();
                giveBack(entry);
            }
        }
    }

    /**
     * Reset entries whose dispatcher died mid-run.
     */
    @Scheduled(fixedDelayString = "${scheduler.worker.stall-check-interval-ms:60000}")
    public void recoverStalled() {
        int recovered = executionQueue.recoverStalled(stallTimeout);
        if (recovered > 0) {
            log.warn("Recovered {} stalled execution entries", recovered);
        }
    }

    /** Run one claimed entry and report the outcome to the queue. */
    void dispatch(QueueEntry entry) {
        try {
            WorkerOutcome outcome = worker.process(entry);
            switch (outcome) {
                case EXECUTED -> executionQueue.complete(entry);
                case SKIPPED_MISSING, SKIPPED_INACTIVE -> executionQueue.discard(entry);
            }
        } catch (Exception e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            try {
                executionQueue.fail(entry, reason);
            } catch (Exception queueError) {
                log.error("Could not record failure of entry {}: {}",
                        entry.getEntryId(), queueError.getMessage(), queueError);
            }
        }
    }

    /** The pool is shutting down; let another dispatcher pick the entry up. */
    private void giveBack(QueueEntry entry) {
        log.warn("Worker pool rejected entry {}, releasing it", entry.getEntryId());
        try {
            executionQueue.release(entry);
        } catch (Exception e) {
            log.error("Could not release entry {}: {}", entry.getEntryId(), e.getMessage(), e);
        }
    }

    int inFlight() {
        return inFlight.get();
    }

    @PreDestroy
    void shutdown() throws InterruptedException {
        workers.shutdown();
        if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Worker pool did not drain within 30s, interrupting in-flight jobs");
            workers.shutdownNow();
        }
    }
}
