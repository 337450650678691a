package com.pingpay.scheduler.queue;

import com.pingpay.scheduler.schedule.RepeatOptions;

/**
 * How an entry is scheduled when added to a lane.
 *
 * delayed   - one run, delayMs from now (SPECIFIC_TIME jobs)
 * repeating - first run at the next occurrence, re-armed after every run
 * immediate - one run as soon as a worker is free (manual runs)
 * parked    - never runs (dead-letter lane)
 */
public record QueueOptions(Long delayMs, RepeatOptions repeat, boolean parked) {

    public static QueueOptions delayed(long delayMs) {
        return new QueueOptions(delayMs, null, false);
    }

    public static QueueOptions repeating(RepeatOptions repeat) {
        return new QueueOptions(null, repeat, false);
    }

    public static QueueOptions immediate() {
        return new QueueOptions(0L, null, false);
    }

    public static QueueOptions parkedEntry() {
        return new QueueOptions(null, null, true);
    }
}
