package com.engagesphere.booster.domain.scheduling;

import java.time.Instant;

public record PlannedJob(
        JobKind kind,
        String jobId,
        Instant dueTime
) {}
