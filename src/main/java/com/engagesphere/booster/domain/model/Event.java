package com.engagesphere.booster.domain.model;

import java.time.Instant;

public record Event(
        Long id,
        String name,
        String description,
        Instant eventTime,
        String recordingUrl,
        String imageUrl
) {}
