package com.pingpay.scheduler.queue;

/**
 * State of a single queue entry.
 *
 * Transitions (execution lane):
 *   WAITING → ACTIVE  (claimed by a dispatcher tick)
 *   ACTIVE  → WAITING (repeat re-armed, retry scheduled, or stall recovered)
 *   ACTIVE  → (row deleted) one-shot completed or retries exhausted
 *
 * Dead-letter entries are always PARKED.
 */
public enum QueueEntryState {
    WAITING,
    ACTIVE,
    PARKED
}
