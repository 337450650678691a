package com.pingpay.scheduler.worker.action;

/**
 * Thrown when a job's target action fails: non-2xx response, timeout,
 * unreachable target, or an unsupported job type.
 *
 * Never reaches an API caller. The worker records it on the job row and
 * re-throws it so the queue applies its retry/backoff policy.
 */
public class ActionExecutionException extends RuntimeException {

    public ActionExecutionException(String message) {
        super(message);
    }

    public ActionExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
