package com.pingpay.scheduler.worker.action;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the {@link JobAction} for a job's type and runs it with metrics.
 *
 * Every {@code JobAction} bean is collected at startup. Each execution is
 * timed and counted:
 * <pre>
 *   scheduler.action.calls{type, status="success|error"}
 *   scheduler.action.duration{type}
 * </pre>
 */
@Component
public class JobActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobActionRegistry.class);

    private final Map<JobType, JobAction> actions = new EnumMap<>(JobType.class);
    private final MeterRegistry meterRegistry;

    public JobActionRegistry(List<JobAction> allActions, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (JobAction action : allActions) {
            JobAction previous = actions.put(action.type(), action);
            if (previous != null) {
                throw new IllegalStateException("Two actions registered for job type " + action.type()
                        + ": " + previous.getClass().getSimpleName() + ", " + action.getClass().getSimpleName());
            }
            log.info("Registered {} for job type '{}'", action.getClass().getSimpleName(), action.type().value());
        }
    }

    public boolean supports(JobType type) {
        return actions.containsKey(type);
    }

    /**
     * Run the action for {@code job}.
     *
     * @throws ActionExecutionException on any failure, including an
     *         unsupported type or an unexpected exception from the action
     */
    public void execute(Job job) {
        JobType type = job.getType();
        JobAction action = type != null ? actions.get(type) : null;
        if (action == null) {
            throw new ActionExecutionException("Unsupported job type: " + (type != null ? type.value() : null));
        }

        String typeTag = type.value();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            action.execute(job);
        } catch (ActionExecutionException e) {
            status = "error";
            throw e;
        } catch (Exception e) {
            status = "error";
            throw new ActionExecutionException(
                    "Unexpected error in " + typeTag + " action: " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("scheduler.action.duration", "type", typeTag));
            meterRegistry.counter("scheduler.action.calls", "type", typeTag, "status", status).increment();
        }
    }
}
