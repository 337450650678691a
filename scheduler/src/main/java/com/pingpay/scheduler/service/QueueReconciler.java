package com.pingpay.scheduler.service;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobStatus;
import com.pingpay.scheduler.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Rebuilds both queue lanes from the jobs table, which is the source of
 * truth. Repairs the drift a failed lane update leaves behind.
 *
 *   ACTIVE / FAILED with a future run → execution lane
 *   ACTIVE / FAILED without one       → neither lane (finished one-shot)
 *   INACTIVE, acknowledged            → neither lane (completed from the DLQ)
 *   INACTIVE                          → dead-letter lane
 *
 * Entries already in the right lane are not touched, so a repeating entry
 * keeps its current run_at and a one-shot entry waiting out its retry
 * backoff keeps its remaining attempts. The queue removes that entry
 * itself once it completes or runs out of attempts. Runs once at startup unless
 * scheduler.reconcile-on-startup=false, and on POST /admin/reconcile.
 */
@Service
public class QueueReconciler {

    private static final Logger log = LoggerFactory.getLogger(QueueReconciler.class);

    private final JobRepository       jobRepo;
    private final JobQueueCoordinator queues;
    private final Clock               clock;
    private final boolean             onStartup;

    public QueueReconciler(JobRepository jobRepo,
                           JobQueueCoordinator queues,
                           Clock clock,
                           @Value("${scheduler.reconcile-on-startup:true}") boolean onStartup) {
        this.jobRepo   = jobRepo;
        this.queues    = queues;
        this.clock     = clock;
        this.onStartup = onStartup;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void reconcileOnStartup() {
        if (!onStartup) return;
        try {
            reconcileAll();
        } catch (RuntimeException e) {
            log.error("Startup queue reconciliation failed: {}", e.getMessage(), e);
        }
    }

    public ReconcileReport reconcileAll() {
        List<Job> jobs = jobRepo.findAll();
        int armed = 0, parked = 0, unchanged = 0, unarmed = 0;

        for (Job job : jobs) {
            UUID id = job.getId();
            boolean inExecution  = queues.inExecutionLane(id);
            boolean inDeadLetter = queues.inDeadLetterLane(id);

            if (job.getStatus() == JobStatus.INACTIVE) {
                if (isAcknowledged(job)) {
                    if (inExecution || inDeadLetter) {
                        queues.disarm(id);
                    }
                    unarmed++;
                } else if (inDeadLetter && !inExecution) {
                    unchanged++;
                } else {
                    queues.park(job);
                    parked++;
                }
                continue;
            }

            if (inExecution && !inDeadLetter) {
                unchanged++;
            } else if (JobQueueCoordinator.optionsFor(job.schedule(), clock.instant()) == null) {
                if (inExecution || inDeadLetter) {
                    queues.disarm(id);
                }
                unarmed++;
            } else if (queues.arm(job)) {
                armed++;
            } else {
                unarmed++;
            }
        }

        Set<UUID> known = jobs.stream().map(Job::getId).collect(Collectors.toSet());
        int orphans = queues.removeOrphans(known);

        ReconcileReport report = new ReconcileReport(armed, parked, unchanged, unarmed, orphans);
        log.info("Queue reconciliation over {} jobs: {}", jobs.size(), report);
        return report;
    }

    /** CompleteFromDeadLetter leaves last_run set and next_run cleared. */
    private static boolean isAcknowledged(Job job) {
        return job.getNextRun() == null && job.getLastRun() != null;
    }
}
