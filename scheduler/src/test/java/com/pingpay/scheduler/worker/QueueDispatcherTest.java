package com.pingpay.scheduler.worker;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobFixtures;
import com.pingpay.scheduler.queue.JobQueue;
import com.pingpay.scheduler.queue.QueueEntry;
import com.pingpay.scheduler.queue.QueueEntryFixtures;
import com.pingpay.scheduler.worker.action.ActionExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Outcome routing and claim sizing of QueueDispatcher.
 */
@ExtendWith(MockitoExtension.class)
class QueueDispatcherTest {

    static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock JobQueue  executionQueue;
    @Mock JobWorker worker;

    QueueDispatcher dispatcher;
    QueueEntry      entry;

    @BeforeEach
    void setUp() {
        dispatcher = new QueueDispatcher(executionQueue, worker, 2, Duration.ofMinutes(5));
        Job job = JobFixtures.job(JobFixtures.cron("0 * * * *"));
        entry = QueueEntryFixtures.claimed(job, null, NOW);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        dispatcher.shutdown();
    }

    @Test
    void dispatch_executed_completesEntry() {
        when(worker.process(entry)).thenReturn(WorkerOutcome.EXECUTED);

        dispatcher.dispatch(entry);

        verify(executionQueue).complete(entry);
        verify(executionQueue, never()).fail(any(), any());
    }

    @Test
    void dispatch_skipped_discardsEntry() {
        when(worker.process(entry)).thenReturn(WorkerOutcome.SKIPPED_MISSING);

        dispatcher.dispatch(entry);

        verify(executionQueue).discard(entry);
        verify(executionQueue, never()).complete(any());
    }

    @Test
    void dispatch_actionFailure_failsEntryForRetry() {
        when(worker.process(entry)).thenThrow(new ActionExecutionException("HTTP 503 from target: "));

        dispatcher.dispatch(entry);

        verify(executionQueue).fail(entry, "HTTP 503 from target: ");
    }

    @Test
    void dispatch_queueErrorWhileRecordingFailure_doesNotEscape() {
        when(worker.process(entry)).thenThrow(new ActionExecutionException("boom"));
        doThrow(new IllegalStateException("db down")).when(executionQueue).fail(any(), anyString());

        dispatcher.dispatch(entry);

        verify(executionQueue).fail(entry, "boom");
    }

    @Test
    void tick_claimsNoMoreThanIdleWorkers() {
        when(executionQueue.claimDue(anyString(), anyInt())).thenReturn(List.of());

        dispatcher.tick();

        verify(executionQueue).claimDue(anyString(), eq(2));
    }

    @Test
    void tick_runsClaimedEntriesOnThePool() {
        when(executionQueue.claimDue(anyString(), anyInt())).thenReturn(List.of(entry));
        when(worker.process(entry)).thenReturn(WorkerOutcome.EXECUTED);

        dispatcher.tick();

        verify(executionQueue, timeout(2000)).complete(entry);
    }

    @Test
    void tick_poolShutDown_releasesClaimAndFreesSlot() throws InterruptedException {
        dispatcher.shutdown();
        when(executionQueue.claimDue(anyString(), anyInt())).thenReturn(List.of(entry));

        dispatcher.tick();

        verify(executionQueue).release(entry);
        verifyNoInteractions(worker);
        assertThat(dispatcher.inFlight()).isZero();
    }

    @Test
    void recoverStalled_usesConfiguredTimeout() {
        when(executionQueue.recoverStalled(Duration.ofMinutes(5))).thenReturn(0);

        dispatcher.recoverStalled();

        verify(executionQueue).recoverStalled(Duration.ofMinutes(5));
    }
}
