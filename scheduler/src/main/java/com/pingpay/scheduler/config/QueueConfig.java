package com.pingpay.scheduler.config;

import com.pingpay.scheduler.queue.JobQueue;
import com.pingpay.scheduler.queue.QueueLane;
import com.pingpay.scheduler.repository.FailedExecutionRepository;
import com.pingpay.scheduler.repository.QueueEntryRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the two queue lanes and the clock everything reads "now" from.
 *
 * Inject a lane with {@code @Qualifier("executionQueue")} or
 * {@code @Qualifier("deadLetterQueue")}.
 */
@Configuration
public class QueueConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    JobQueue executionQueue(QueueEntryRepository entries,
                            FailedExecutionRepository failures,
                            Clock clock,
                            @Value("${scheduler.queue.max-attempts:3}") int maxAttempts,
                            @Value("${scheduler.queue.backoff-initial:1s}") Duration backoffInitial,
                            @Value("${scheduler.queue.failed-retention:500}") int failedRetention) {
        return new JobQueue(QueueLane.EXECUTION, entries, failures, clock,
                maxAttempts, backoffInitial, failedRetention);
    }

    // Parked entries never run, so the retry settings are irrelevant here.
    @Bean
    JobQueue deadLetterQueue(QueueEntryRepository entries,
                             FailedExecutionRepository failures,
                             Clock clock) {
        return new JobQueue(QueueLane.DEAD_LETTER, entries, failures, clock,
                1, Duration.ZERO, 1);
    }
}
