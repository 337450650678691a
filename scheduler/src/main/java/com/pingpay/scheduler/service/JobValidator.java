package com.pingpay.scheduler.service;

import com.pingpay.scheduler.model.JobDefinition;
import com.pingpay.scheduler.model.JobType;
import com.pingpay.scheduler.schedule.ScheduleCalculator;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shape checks for a job definition, run before create and update.
 *
 * The schedule fields must match schedule_type exactly: the fields of the
 * selected type are required and valid, the fields of the other types
 * must be absent.
 */
public final class JobValidator {

    private JobValidator() {}

    /**
     * @throws ValidationException listing every offending field
     */
    public static void validate(JobDefinition d, Instant now) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (d.name() == null || d.name().isBlank()) {
            errors.put("name", "Name is required");
        }
        if (d.type() == null) {
            errors.put("type", "Type is required");
        }
        if (d.target() == null || d.target().isBlank()) {
            errors.put("target", "Target is required");
        } else if (d.type() == JobType.HTTP && !isHttpUrl(d.target())) {
            errors.put("target", "Target must be an http(s) URL");
        }

        if (d.scheduleType() == null) {
            errors.put("schedule_type", "Schedule type is required");
        } else {
            checkSchedule(d, now, errors);
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid job data", errors);
        }
    }

    private static void checkSchedule(JobDefinition d, Instant now, Map<String, String> errors) {
        switch (d.scheduleType()) {
            case CRON -> {
                if (d.cronExpression() == null || d.cronExpression().isBlank()) {
                    errors.put("cron_expression", "Cron expression is required for cron jobs");
                } else if (!ScheduleCalculator.isValidCron(d.cronExpression())) {
                    errors.put("cron_expression", "Invalid cron expression");
                }
                rejectSpecificTime(d, errors);
                rejectInterval(d, errors);
            }
            case SPECIFIC_TIME -> {
                if (d.specificTime() == null) {
                    errors.put("specific_time", "Specific time is required for specific_time jobs");
                } else if (ScheduleCalculator.calculateInitialDelay(d.schedule(), now) == null) {
                    errors.put("specific_time", "Specific time must be in the future");
                }
                rejectCron(d, errors);
                rejectInterval(d, errors);
            }
            case RECURRING -> {
                if (d.interval() == null) {
                    errors.put("interval", "Interval is required for recurring jobs");
                }
                if (d.intervalValue() == null || d.intervalValue() <= 0) {
                    errors.put("interval_value", "Interval value must be a positive integer");
                } else if (d.interval() != null
                        && ScheduleCalculator.calculateNextRun(d.schedule(), now) == null) {
                    errors.put("interval_value", "Interval is too large");
                }
                rejectCron(d, errors);
                rejectSpecificTime(d, errors);
            }
        }
    }

    private static void rejectCron(JobDefinition d, Map<String, String> errors) {
        if (d.cronExpression() != null) {
            errors.put("cron_expression", "Only allowed for cron jobs");
        }
    }

    private static void rejectSpecificTime(JobDefinition d, Map<String, String> errors) {
        if (d.specificTime() != null) {
            errors.put("specific_time", "Only allowed for specific_time jobs");
        }
    }

    private static void rejectInterval(JobDefinition d, Map<String, String> errors) {
        if (d.interval() != null) {
            errors.put("interval", "Only allowed for recurring jobs");
        }
        if (d.intervalValue() != null) {
            errors.put("interval_value", "Only allowed for recurring jobs");
        }
    }

    private static boolean isHttpUrl(String target) {
        try {
            URI uri = new URI(target);
            String scheme = uri.getScheme();
            return uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
