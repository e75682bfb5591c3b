package com.engagesphere.booster.domain.port.out;

import java.time.Instant;

/**
 * Records which scheduled jobs have already been delivered so a job is
 * never sent twice for the same due time.
 */
public interface DeliveryLedger {

    /**
     * @return true if the caller is the first to claim this job occurrence and should deliver it
     */
    boolean claim(String jobId, Instant dueTime);
}
