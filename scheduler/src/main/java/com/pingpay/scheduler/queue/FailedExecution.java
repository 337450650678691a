package com.pingpay.scheduler.queue;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of one queue run that exhausted its attempts.
 * Kept for operator inspection; only the newest N rows are retained.
 *
 * DB table: failed_executions  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "failed_executions")
public class FailedExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "entry_id", nullable = false)
    private String entryId;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private int attempts;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "failed_at", nullable = false)
    private Instant failedAt;

    protected FailedExecution() {}   // required by JPA

    public FailedExecution(QueueEntry entry, Instant failedAt) {
        this.entryId  = entry.getEntryId();
        this.jobId    = entry.getJobId();
        this.name     = entry.getName();
        this.attempts = entry.getAttemptsMade();
        this.error    = entry.getLastError();
        this.failedAt = failedAt;
    }

    public UUID    getId()       { return id; }
    public String  getEntryId()  { return entryId; }
    public UUID    getJobId()    { return jobId; }
    public String  getName()     { return name; }
    public int     getAttempts() { return attempts; }
    public String  getError()    { return error; }
    public Instant getFailedAt() { return failedAt; }
}
