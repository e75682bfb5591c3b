package com.engagesphere.booster.domain.port.out;

import java.time.Instant;
import java.util.Set;

/**
 * One-shot job scheduler keyed by job id.
 * Safe for concurrent use from request threads and the firing loop.
 */
public interface JobScheduler {

    /**
     * Registers a task to run at or after {@code dueTime}.
     *
     * @return false if a job with this id is already pending; the pending job is left untouched
     */
    boolean schedule(String jobId, Instant dueTime, Runnable task);

    /**
     * Removes a pending job.
     *
     * @return false if the job is unknown, already fired or already cancelled
     */
    boolean cancel(String jobId);

    boolean isScheduled(String jobId);

    Set<String> pendingJobIds();
}
