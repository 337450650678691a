package com.pingpay.scheduler.queue;

/**
 * Thrown when adding to or removing from a queue lane fails after the
 * job store has already been updated. The store stays authoritative;
 * the lanes can be rebuilt from it.
 */
public class QueueReconciliationException extends RuntimeException {

    public QueueReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
