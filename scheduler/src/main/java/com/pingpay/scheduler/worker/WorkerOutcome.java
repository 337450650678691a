package com.pingpay.scheduler.worker;

/**
 * What the worker did with one dequeued entry. Failures are not an
 * outcome: they propagate as exceptions so the queue can retry.
 */
public enum WorkerOutcome {
    EXECUTED,           // action ran and succeeded
    SKIPPED_MISSING,    // job row deleted after the entry was queued
    SKIPPED_INACTIVE    // job switched to INACTIVE after the entry was queued
}
