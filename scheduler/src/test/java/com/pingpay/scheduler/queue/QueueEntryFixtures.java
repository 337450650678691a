package com.pingpay.scheduler.queue;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.schedule.RepeatOptions;

import java.lang.reflect.Field;
import java.time.Instant;
import java.util.UUID;

/**
 * Queue entries in a given state, built without a database.
 */
public final class QueueEntryFixtures {

    public static final String WORKER = "dispatcher-test";

    private QueueEntryFixtures() {}

    /** A scheduled entry (entry id = job id) claimed by {@link #WORKER}. */
    public static QueueEntry claimed(Job job, RepeatOptions repeat, Instant now) {
        return claimed(job, job.getId().toString(), repeat, now);
    }

    public static QueueEntry claimed(Job job, String entryId, RepeatOptions repeat, Instant now) {
        QueueEntry entry = waiting(job, entryId, repeat, now);
        entry.claim(WORKER, now);
        return entry;
    }

    public static QueueEntry waiting(Job job, String entryId, RepeatOptions repeat, Instant now) {
        QueueEntry entry = new QueueEntry(QueueLane.EXECUTION, entryId);
        entry.load(JobData.of(job));
        QueueOptions options = repeat != null ? QueueOptions.repeating(repeat) : QueueOptions.immediate();
        entry.arm(options, now, repeat != null ? now : null, 3);
        setId(entry, UUID.randomUUID());
        return entry;
    }

    static void setId(QueueEntry entry, UUID id) {
        try {
            Field f = QueueEntry.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(entry, id);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(e);
        }
    }
}
