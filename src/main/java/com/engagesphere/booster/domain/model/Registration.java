package com.engagesphere.booster.domain.model;

import java.time.Instant;

public record Registration(
        Long id,
        Long userId,
        Long eventId,
        Instant registrationTime
) {}
