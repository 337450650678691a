package com.pingpay.scheduler.model;

import com.pingpay.scheduler.schedule.ScheduleSpec;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A persisted unit of scheduled work: a target action plus a schedule.
 *
 * This table is the single source of truth. The execution and dead-letter
 * lanes in queue_entries are projections of (status, schedule fields) and
 * use the job id as their entry id.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobType type;

    // URL for HTTP jobs.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String target;

    // Opaque JSON body delivered to the target.
    @Column(columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_type", nullable = false)
    private ScheduleType scheduleType;

    @Column(name = "cron_expression")
    private String cronExpression;

    @Column(name = "specific_time")
    private Instant specificTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "repeat_interval")
    private Interval interval;

    @Column(name = "interval_value")
    private Integer intervalValue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.ACTIVE;

    @Column(name = "last_run")
    private Instant lastRun;

    // Null for completed SPECIFIC_TIME jobs.
    @Column(name = "next_run")
    private Instant nextRun;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(JobDefinition definition) {
        apply(definition);
    }

    /**
     * Overwrite every caller-owned field with the given definition
     * (full-replace semantics of PUT /jobs/{id}).
     */
    public void apply(JobDefinition d) {
        this.name           = d.name();
        this.description    = d.description();
        this.type           = d.type();
        this.target         = d.target();
        this.payload        = d.payload();
        this.scheduleType   = d.scheduleType();
        this.cronExpression = d.cronExpression();
        this.specificTime   = d.specificTime();
        this.interval       = d.interval();
        this.intervalValue  = d.intervalValue();
        this.status         = d.statusOrDefault();
    }

    public ScheduleSpec schedule() {
        return new ScheduleSpec(scheduleType, cronExpression, specificTime, interval, intervalValue);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID         getId()             { return id; }
    public String       getName()           { return name; }
    public String       getDescription()    { return description; }
    public JobType      getType()           { return type; }
    public String       getTarget()         { return target; }
    public String       getPayload()        { return payload; }
    public ScheduleType getScheduleType()   { return scheduleType; }
    public String       getCronExpression() { return cronExpression; }
    public Instant      getSpecificTime()   { return specificTime; }
    public Interval     getInterval()       { return interval; }
    public Integer      getIntervalValue()  { return intervalValue; }
    public JobStatus    getStatus()         { return status; }
    public Instant      getLastRun()        { return lastRun; }
    public Instant      getNextRun()        { return nextRun; }
    public String       getErrorMessage()   { return errorMessage; }
    public Instant      getCreatedAt()      { return createdAt; }
    public Instant      getUpdatedAt()      { return updatedAt; }

    public void setStatus(JobStatus status)         { this.status = status; }
    public void setLastRun(Instant lastRun)         { this.lastRun = lastRun; }
    public void setNextRun(Instant nextRun)         { this.nextRun = nextRun; }
    public void setErrorMessage(String message)     { this.errorMessage = message; }
}
