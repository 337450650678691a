package com.pingpay.scheduler.schedule;

import com.pingpay.scheduler.model.Interval;

/**
 * Repeat configuration handed to the execution queue for CRON and
 * RECURRING jobs. Either {@code pattern} is set (cron) or
 * {@code interval} + {@code every} are.
 */
public record RepeatOptions(String pattern, Interval interval, Integer every) {

    public static RepeatOptions cron(String pattern) {
        return new RepeatOptions(pattern, null, null);
    }

    public static RepeatOptions every(int every, Interval interval) {
        return new RepeatOptions(null, interval, every);
    }

    public boolean isCron() {
        return pattern != null;
    }
}
