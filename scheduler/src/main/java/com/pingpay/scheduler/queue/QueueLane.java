package com.pingpay.scheduler.queue;

/**
 * The two lanes a job can be projected into.
 *
 * EXECUTION   - entries are claimed by the dispatcher when run_at is due
 * DEAD_LETTER - entries are parked for inspection and never claimed
 *
 * A job id is present in at most one lane at a time.
 */
public enum QueueLane {
    EXECUTION,
    DEAD_LETTER
}
