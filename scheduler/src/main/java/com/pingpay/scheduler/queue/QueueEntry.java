package com.pingpay.scheduler.queue;

import com.pingpay.scheduler.model.Interval;
import com.pingpay.scheduler.model.JobType;
import com.pingpay.scheduler.schedule.RepeatOptions;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry in the execution or dead-letter lane.
 *
 * (lane, entry_id) is unique, so adding an entry with an id that is
 * already in the lane updates it in place instead of creating a second
 * one. For scheduled runs entry_id equals the job id; manual runs use
 * "{jobId}-manual-{epochMillis}" so they never collide with the
 * scheduled entry.
 *
 * DB table: queue_entries  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "queue_entries",
       uniqueConstraints = @UniqueConstraint(name = "uq_queue_entries_lane_entry",
                                             columnNames = {"lane", "entry_id"}))
public class QueueEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QueueLane lane;

    @Column(name = "entry_id", nullable = false)
    private String entryId;

    // --- job snapshot ---

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobType type;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String target;

    @Column(columnDefinition = "TEXT")
    private String payload;

    // --- scheduling ---

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QueueEntryState state = QueueEntryState.WAITING;

    // Null for parked entries.
    @Column(name = "run_at")
    private Instant runAt;

    @Column(name = "repeat_pattern")
    private String repeatPattern;

    @Enumerated(EnumType.STRING)
    @Column(name = "repeat_interval")
    private Interval repeatInterval;

    @Column(name = "repeat_every")
    private Integer repeatEvery;

    // --- retry ---

    @Column(name = "attempts_made", nullable = false)
    private int attemptsMade = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // Which dispatcher claimed the entry, and when. Null unless ACTIVE.
    @Column(name = "locked_by")
    private String lockedBy;

    @Column(name = "locked_at")
    private Instant lockedAt;

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

    protected QueueEntry() {}   // required by JPA

    public QueueEntry(QueueLane lane, String entryId) {
        this.lane    = lane;
        this.entryId = entryId;
    }

    // ------------------------------------------------------------------
    // State changes
    // ------------------------------------------------------------------

    /** Replace the job snapshot. */
    void load(JobData data) {
        this.jobId   = data.jobId();
        this.name    = data.name();
        this.type    = data.type();
        this.target  = data.target();
        this.payload = data.payload();
    }

    /**
     * (Re)schedule according to the options. Resets attempts and any claim.
     * {@code firstRun} is only used for repeating options.
     */
    void arm(QueueOptions options, Instant now, Instant firstRun, int maxAttempts) {
        this.maxAttempts  = maxAttempts;
        this.attemptsMade = 0;
        this.lastError    = null;
        this.lockedBy     = null;
        this.lockedAt     = null;

        RepeatOptions repeat = options.repeat();
        this.repeatPattern  = repeat != null ? repeat.pattern()  : null;
        this.repeatInterval = repeat != null ? repeat.interval() : null;
        this.repeatEvery    = repeat != null ? repeat.every()    : null;

        if (options.parked()) {
            this.state = QueueEntryState.PARKED;
            this.runAt = null;
        } else if (repeat != null) {
            this.state = QueueEntryState.WAITING;
            this.runAt = firstRun;
        } else {
            long delay = options.delayMs() != null ? options.delayMs() : 0L;
            this.state = QueueEntryState.WAITING;
            this.runAt = now.plusMillis(delay);
        }
    }

    void claim(String workerId, Instant now) {
        this.state    = QueueEntryState.ACTIVE;
        this.lockedBy = workerId;
        this.lockedAt = now;
    }

    void rearm(Instant runAt) {
        this.state    = QueueEntryState.WAITING;
        this.runAt    = runAt;
        this.lockedBy = null;
        this.lockedAt = null;
    }

    void recordAttemptFailure(String error) {
        this.attemptsMade++;
        this.lastError = error;
    }

    void resetAttempts() {
        this.attemptsMade = 0;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID            getId()           { return id; }
    public QueueLane       getLane()         { return lane; }
    public String          getEntryId()      { return entryId; }
    public UUID            getJobId()        { return jobId; }
    public String          getName()         { return name; }
    public JobType         getType()         { return type; }
    public String          getTarget()       { return target; }
    public String          getPayload()      { return payload; }
    public QueueEntryState getState()        { return state; }
    public Instant         getRunAt()        { return runAt; }
    public int             getAttemptsMade() { return attemptsMade; }
    public int             getMaxAttempts()  { return maxAttempts; }
    public String          getLastError()    { return lastError; }
    public String          getLockedBy()     { return lockedBy; }
    public Instant         getLockedAt()     { return lockedAt; }
    public Instant         getCreatedAt()    { return createdAt; }

    public RepeatOptions repeat() {
        if (repeatPattern != null) return RepeatOptions.cron(repeatPattern);
        if (repeatInterval != null && repeatEvery != null) return RepeatOptions.every(repeatEvery, repeatInterval);
        return null;
    }

    public boolean isRepeating() {
        return repeat() != null;
    }

    /** True for out-of-band entries created by a manual run. */
    public boolean isManualRun() {
        return jobId != null && !entryId.equals(jobId.toString());
    }
}
