package com.engagesphere.booster.infrastructure.web.dto;

import com.engagesphere.booster.infrastructure.scheduler.SchedulerStats;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Set;

public record SchedulerStatusResponse(
        boolean running,
        int pending,
        long scheduled,
        long fired,
        long cancelled,
        long failed,
        @JsonProperty("pending_job_ids") List<String> pendingJobIds
) {
    public static SchedulerStatusResponse from(boolean running, SchedulerStats stats, Set<String> jobIds) {
        return new SchedulerStatusResponse(
                running,
                stats.pending(),
                stats.scheduled(),
                stats.fired(),
                stats.cancelled(),
                stats.failed(),
                jobIds.stream().sorted().toList()
        );
    }
}
