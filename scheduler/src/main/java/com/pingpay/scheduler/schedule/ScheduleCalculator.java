package com.pingpay.scheduler.schedule;

import com.pingpay.scheduler.model.ScheduleType;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Pure translation from a job's schedule fields to queue scheduling
 * parameters and next-run timestamps.
 *
 * All methods are deterministic given their "as of" instant and return
 * null instead of guessing when the schedule is unusable (past one-shot
 * time, malformed cron, missing or non-positive interval, a next run past
 * {@link #LATEST_RUN}). Callers treat null as a rejection.
 *
 * Cron expressions are evaluated in UTC. Both the classic 5-field form
 * ("m h dom mon dow") and Spring's 6-field form with seconds are accepted,
 * as are the "@daily"-style macros.
 */
public final class ScheduleCalculator {

    /** Latest next run the job store accepts. */
    public static final Instant LATEST_RUN = Instant.parse("9999-12-31T23:59:59Z");

    private ScheduleCalculator() {}

    // ------------------------------------------------------------------
    // One-shot delay
    // ------------------------------------------------------------------

    public static Long calculateInitialDelay(ScheduleSpec spec) {
        return calculateInitialDelay(spec, Instant.now());
    }

    /**
     * Milliseconds from {@code now} until a SPECIFIC_TIME job is due.
     *
     * @return null for other schedule types, or when the time is not
     *         strictly in the future
     */
    public static Long calculateInitialDelay(ScheduleSpec spec, Instant now) {
        if (spec == null || spec.type() != ScheduleType.SPECIFIC_TIME || spec.specificTime() == null) {
            return null;
        }
        long delay = Duration.between(now, spec.specificTime()).toMillis();
        return delay > 0 ? delay : null;
    }

    // ------------------------------------------------------------------
    // Repeat configuration
    // ------------------------------------------------------------------

    /**
     * Repeat options for CRON (expression passed through unmodified) and
     * RECURRING (every N base units) jobs.
     *
     * @return null for SPECIFIC_TIME, a malformed cron expression, or a
     *         missing/non-positive interval
     */
    public static RepeatOptions calculateRepeatOptions(ScheduleSpec spec) {
        if (spec == null || spec.type() == null) return null;
        return switch (spec.type()) {
            case CRON -> parseCron(spec.cronExpression()).isPresent()
                    ? RepeatOptions.cron(spec.cronExpression())
                    : null;
            case RECURRING -> validInterval(spec)
                    ? RepeatOptions.every(spec.intervalValue(), spec.interval())
                    : null;
            case SPECIFIC_TIME -> null;
        };
    }

    // ------------------------------------------------------------------
    // Next run
    // ------------------------------------------------------------------

    public static Instant calculateNextRun(ScheduleSpec spec) {
        return calculateNextRun(spec, Instant.now());
    }

    /**
     * The next instant after {@code asOf} at which the job is due.
     *
     * CRON          - next cron fire time strictly after asOf
     * RECURRING     - asOf + intervalValue units of interval, or null if that
     *                 lands after {@link #LATEST_RUN}
     * SPECIFIC_TIME - specificTime if still ahead of asOf, otherwise null
     */
    public static Instant calculateNextRun(ScheduleSpec spec, Instant asOf) {
        if (spec == null || spec.type() == null) return null;
        return switch (spec.type()) {
            case CRON -> parseCron(spec.cronExpression())
                    .map(cron -> nextCronFire(cron, asOf))
                    .orElse(null);
            case RECURRING -> validInterval(spec)
                    ? plusInterval(asOf, spec)
                    : null;
            case SPECIFIC_TIME -> spec.specificTime() != null && spec.specificTime().isAfter(asOf)
                    ? spec.specificTime()
                    : null;
        };
    }

    /**
     * Next occurrence of a repeat configuration after {@code asOf}.
     * Used by the queue to re-arm repeating entries.
     */
    public static Instant nextOccurrence(RepeatOptions repeat, Instant asOf) {
        if (repeat == null) return null;
        if (repeat.isCron()) {
            return calculateNextRun(ScheduleSpec.cron(repeat.pattern()), asOf);
        }
        if (repeat.interval() == null || repeat.every() == null) return null;
        return calculateNextRun(ScheduleSpec.every(repeat.every(), repeat.interval()), asOf);
    }

    // ------------------------------------------------------------------
    // Cron parsing
    // ------------------------------------------------------------------

    public static boolean isValidCron(String expression) {
        return parseCron(expression).isPresent();
    }

    static Optional<CronExpression> parseCron(String expression) {
        if (expression == null || expression.isBlank()) return Optional.empty();

        String trimmed = expression.trim();
        String normalized;
        if (trimmed.startsWith("@")) {
            normalized = trimmed;
        } else {
            int fields = trimmed.split("\\s+").length;
            if (fields == 5) {
                normalized = "0 " + trimmed;   // Spring wants a seconds field
            } else if (fields == 6) {
                normalized = trimmed;
            } else {
                return Optional.empty();
            }
        }

        try {
            return Optional.of(CronExpression.parse(normalized));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Instant nextCronFire(CronExpression cron, Instant asOf) {
        ZonedDateTime next = cron.next(asOf.atZone(ZoneOffset.UTC));
        return next != null ? next.toInstant() : null;
    }

    private static boolean validInterval(ScheduleSpec spec) {
        return spec.interval() != null && spec.intervalValue() != null && spec.intervalValue() > 0;
    }

    private static Instant plusInterval(Instant asOf, ScheduleSpec spec) {
        try {
            Instant next = asOf.atZone(ZoneOffset.UTC)
                    .plus(spec.intervalValue(), spec.interval().unit())
                    .toInstant();
            return next.isAfter(LATEST_RUN) ? null : next;
        } catch (DateTimeException | ArithmeticException e) {
            return null;
        }
    }
}
