package com.pingpay.scheduler.service;

import com.pingpay.scheduler.model.Interval;
import com.pingpay.scheduler.model.JobDefinition;
import com.pingpay.scheduler.model.JobFixtures;
import com.pingpay.scheduler.model.JobType;
import com.pingpay.scheduler.model.ScheduleType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class JobValidatorTest {

    static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void validDefinitions_pass() {
        assertThatCode(() -> JobValidator.validate(JobFixtures.recurring(1, Interval.DAY), NOW)).doesNotThrowAnyException();
        assertThatCode(() -> JobValidator.validate(JobFixtures.cron("0 * * * *"), NOW)).doesNotThrowAnyException();
        assertThatCode(() -> JobValidator.validate(JobFixtures.at(NOW.plusSeconds(300)), NOW)).doesNotThrowAnyException();
    }

    @Test
    void specificTimeInThePast_isRejectedOnSpecificTime() {
        ValidationException e = catchValidation(JobFixtures.at(NOW.minusSeconds(1)));

        assertThat(e.getErrors()).containsEntry("specific_time", "Specific time must be in the future");
    }

    @Test
    void malformedCron_isRejected() {
        ValidationException e = catchValidation(JobFixtures.cron("every day at noon"));

        assertThat(e.getErrors()).containsOnlyKeys("cron_expression");
    }

    @Test
    void recurringWithoutPositiveValue_isRejected() {
        ValidationException e = catchValidation(JobFixtures.recurring(0, Interval.HOUR));

        assertThat(e.getErrors()).containsOnlyKeys("interval_value");
    }

    @Test
    void recurringWithNextRunPastYear9999_isRejectedOnIntervalValue() {
        ValidationException e = catchValidation(JobFixtures.recurring(2_000_000_000, Interval.YEAR));

        assertThat(e.getErrors()).containsOnlyKeys("interval_value");
        assertThat(e.getErrors()).containsEntry("interval_value", "Interval is too large");
        assertThat(catchValidation(JobFixtures.recurring(10_000, Interval.YEAR)).getErrors())
                .containsOnlyKeys("interval_value");
    }

    @Test
    void fieldsOfAnotherScheduleType_areRejected() {
        JobDefinition mixed = new JobDefinition("mixed", null, JobType.HTTP, JobFixtures.TARGET, null,
                ScheduleType.CRON, "0 * * * *", NOW.plusSeconds(60), Interval.DAY, 1, null);

        ValidationException e = catchValidation(mixed);

        assertThat(e.getErrors()).containsOnlyKeys("specific_time", "interval", "interval_value");
    }

    @Test
    void missingBasics_areAllReportedTogether() {
        JobDefinition empty = new JobDefinition(" ", null, null, null, null, null, null, null, null, null, null);

        ValidationException e = catchValidation(empty);

        assertThat(e.getMessage()).isEqualTo("Invalid job data");
        assertThat(e.getErrors()).containsOnlyKeys("name", "type", "target", "schedule_type");
    }

    @Test
    void httpJobWithNonHttpTarget_isRejected() {
        JobDefinition ftp = new JobDefinition("ftp", null, JobType.HTTP, "ftp://files.example/x", null,
                ScheduleType.CRON, "0 * * * *", null, null, null, null);

        assertThat(catchValidation(ftp).getErrors()).containsOnlyKeys("target");
    }

    private static ValidationException catchValidation(JobDefinition d) {
        try {
            JobValidator.validate(d, NOW);
        } catch (ValidationException e) {
            return e;
        }
        throw new AssertionError("expected ValidationException");
    }
}
