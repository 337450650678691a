package com.pingpay.scheduler.repository;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + worker bookkeeping for the jobs table.
 *
 * The worker writes run results with targeted UPDATEs instead of saving
 * the entity it read, so a concurrent PUT or status change made while the
 * action was running is not overwritten.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    List<Job> findAllByOrderByCreatedAtDesc();

    List<Job> findByStatusOrderByCreatedAtDesc(JobStatus status);

    /** Dead-letter listing: most recently parked first. */
    List<Job> findByStatusOrderByUpdatedAtDesc(JobStatus status);

    /** Successful scheduled run: stamp last_run, move next_run, clear the error. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.lastRun = :ranAt, j.nextRun = :nextRun, j.errorMessage = NULL, j.updatedAt = :ranAt
            WHERE j.id = :id
            """)
    int recordSuccess(@Param("id") UUID id, @Param("ranAt") Instant ranAt, @Param("nextRun") Instant nextRun);

    /** Successful manual run: the schedule (and therefore next_run) is untouched. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.lastRun = :ranAt, j.errorMessage = NULL, j.updatedAt = :ranAt
            WHERE j.id = :id
            """)
    int recordManualSuccess(@Param("id") UUID id, @Param("ranAt") Instant ranAt);

    /**
     * Failed run: record the error and mark FAILED, unless the job was
     * switched to INACTIVE while the action was running.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.errorMessage = :error, j.status = com.pingpay.scheduler.model.JobStatus.FAILED, j.updatedAt = :at
            WHERE j.id = :id AND j.status <> com.pingpay.scheduler.model.JobStatus.INACTIVE
            """)
    int recordFailure(@Param("id") UUID id, @Param("error") String error, @Param("at") Instant at);
}
