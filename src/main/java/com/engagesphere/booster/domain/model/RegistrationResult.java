package com.engagesphere.booster.domain.model;

public record RegistrationResult(
        User user,
        Event event
) {}
