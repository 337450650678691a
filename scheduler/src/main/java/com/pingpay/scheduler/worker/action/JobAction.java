package com.pingpay.scheduler.worker.action;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobType;

/**
 * What a job does when it fires. One implementation per {@link JobType},
 * collected by {@link JobActionRegistry}; adding a job type means adding
 * an enum constant and a {@code @Component} implementing this interface.
 */
public interface JobAction {

    /** The job type this action handles. */
    JobType type();

    /**
     * Perform the action for the given (freshly read) job row.
     * Must be time-bounded so a slow target cannot pin a worker thread.
     *
     * @throws ActionExecutionException if the action did not succeed
     */
    void execute(Job job) throws ActionExecutionException;
}
