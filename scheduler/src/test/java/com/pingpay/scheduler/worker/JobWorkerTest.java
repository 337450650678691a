package com.pingpay.scheduler.worker;

import com.pingpay.scheduler.model.Interval;
import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobFixtures;
import com.pingpay.scheduler.model.JobStatus;
import com.pingpay.scheduler.queue.QueueEntry;
import com.pingpay.scheduler.queue.QueueEntryFixtures;
import com.pingpay.scheduler.repository.JobRepository;
import com.pingpay.scheduler.schedule.RepeatOptions;
import com.pingpay.scheduler.worker.action.ActionExecutionException;
import com.pingpay.scheduler.worker.action.JobActionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobWorker: skip rules, result bookkeeping, failure propagation.
 */
@ExtendWith(MockitoExtension.class)
class JobWorkerTest {

    static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock JobRepository     jobRepo;
    @Mock JobActionRegistry actions;

    JobWorker worker;

    @BeforeEach
    void setUp() {
        worker = new JobWorker(jobRepo, actions, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void process_rowDeleted_skipsWithoutCallingTarget() {
        Job job = JobFixtures.job(JobFixtures.cron("0 * * * *"));
        QueueEntry entry = QueueEntryFixtures.claimed(job, RepeatOptions.cron("0 * * * *"), NOW);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.empty());

        WorkerOutcome outcome = worker.process(entry);

        assertThat(outcome).isEqualTo(WorkerOutcome.SKIPPED_MISSING);
        verifyNoInteractions(actions);
    }

    @Test
    void process_rowInactive_skipsExecution() {
        Job job = JobFixtures.job(JobFixtures.withStatus(JobFixtures.cron("0 * * * *"), JobStatus.INACTIVE));
        QueueEntry entry = QueueEntryFixtures.claimed(job, RepeatOptions.cron("0 * * * *"), NOW);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));

        assertThat(worker.process(entry)).isEqualTo(WorkerOutcome.SKIPPED_INACTIVE);
        verifyNoInteractions(actions);
        verify(jobRepo, never()).recordSuccess(any(), any(), any());
    }

    @Test
    void process_success_recordsLastRunAndNextRun() {
        Job job = JobFixtures.job(JobFixtures.recurring(1, Interval.DAY));
        QueueEntry entry = QueueEntryFixtures.claimed(job, RepeatOptions.every(1, Interval.DAY), NOW);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));

        WorkerOutcome outcome = worker.process(entry);

        assertThat(outcome).isEqualTo(WorkerOutcome.EXECUTED);
        verify(actions).execute(job);
        verify(jobRepo).recordSuccess(job.getId(), NOW, NOW.plus(Duration.ofDays(1)));
    }

    @Test
    void process_oneShotSuccess_leavesNoNextRun() {
        Job job = JobFixtures.job(JobFixtures.at(NOW.plusSeconds(1)));
        QueueEntry entry = QueueEntryFixtures.claimed(job, null, NOW);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));

        worker.process(entry);

        verify(jobRepo).recordSuccess(job.getId(), NOW, null);
    }

    @Test
    void process_failedJobSucceeds_staysFailed() {
        Job job = JobFixtures.job(JobFixtures.withStatus(JobFixtures.cron("0 * * * *"), JobStatus.FAILED));
        QueueEntry entry = QueueEntryFixtures.claimed(job, RepeatOptions.cron("0 * * * *"), NOW);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));

        assertThat(worker.process(entry)).isEqualTo(WorkerOutcome.EXECUTED);

        verify(jobRepo).recordSuccess(eq(job.getId()), eq(NOW), any());
        verify(jobRepo, never()).save(any());
    }

    @Test
    void process_manualRun_doesNotMoveNextRun() {
        Job job = JobFixtures.job(JobFixtures.cron("0 * * * *"));
        QueueEntry entry = QueueEntryFixtures.claimed(job, job.getId() + "-manual-1", null, NOW);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));

        worker.process(entry);

        verify(jobRepo).recordManualSuccess(job.getId(), NOW);
        verify(jobRepo, never()).recordSuccess(any(), any(), any());
    }

    @Test
    void process_actionFails_marksJobFailedAndRethrows() {
        Job job = JobFixtures.job(JobFixtures.cron("0 * * * *"));
        QueueEntry entry = QueueEntryFixtures.claimed(job, RepeatOptions.cron("0 * * * *"), NOW);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        doThrow(new ActionExecutionException("HTTP 500 from target: boom")).when(actions).execute(job);

        assertThatThrownBy(() -> worker.process(entry))
                .isInstanceOf(ActionExecutionException.class)
                .hasMessageContaining("HTTP 500");

        verify(jobRepo).recordFailure(job.getId(), "HTTP 500 from target: boom", NOW);
        verify(jobRepo, never()).recordSuccess(any(), any(), any());
    }

    @Test
    void process_clearsMdcAfterRun() {
        Job job = JobFixtures.job(JobFixtures.cron("0 * * * *"));
        QueueEntry entry = QueueEntryFixtures.claimed(job, RepeatOptions.cron("0 * * * *"), NOW);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.empty());

        worker.process(entry);

        assertThat(MDC.get("jobId")).isNull();
    }
}
