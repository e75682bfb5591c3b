package com.engagesphere.booster.infrastructure.scheduler;

import java.util.Locale;

/**
 * Job counters since start-up
 */
public record SchedulerStats(
        int pending,
        long scheduled,
        long fired,
        long cancelled,
        long failed
) {
    public double failureRatio() {
        return fired > 0 ? (double) failed / fired : 0.0;
    }

    public String summary() {
        return String.format(Locale.ROOT, "Pending: %d, fired: %d, cancelled: %d, failed: %d (%.1f%%)",
                pending, fired, cancelled, failed, failureRatio() * 100);
    }
}
