package com.pingpay.scheduler.repository;

import com.pingpay.scheduler.queue.QueueEntry;
import com.pingpay.scheduler.queue.QueueEntryState;
import com.pingpay.scheduler.queue.QueueLane;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for both queue lanes (queue_entries).
 */
public interface QueueEntryRepository extends JpaRepository<QueueEntry, UUID> {

    Optional<QueueEntry> findByLaneAndEntryId(QueueLane lane, String entryId);

    boolean existsByLaneAndEntryId(QueueLane lane, String entryId);

    List<QueueEntry> findByLaneOrderByCreatedAtAsc(QueueLane lane);

    /**
     * Lock up to {@code page.size} due entries of a lane.
     *
     * PESSIMISTIC_WRITE + lock timeout -2 is Hibernate's spelling of
     * SELECT ... FOR UPDATE SKIP LOCKED: rows locked by another dispatcher
     * are skipped rather than waited on. Must run inside a transaction that
     * flips the rows to ACTIVE before it commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT e FROM QueueEntry e
            WHERE e.lane = :lane AND e.state = :state AND e.runAt <= :now
            ORDER BY e.runAt ASC
            """)
    List<QueueEntry> findDueForUpdate(@Param("lane") QueueLane lane,
                                      @Param("state") QueueEntryState state,
                                      @Param("now") Instant now,
                                      Pageable page);

    /** ACTIVE entries whose claim is older than the cutoff (crashed worker). */
    List<QueueEntry> findByLaneAndStateAndLockedAtBefore(QueueLane lane, QueueEntryState state, Instant cutoff);
}
