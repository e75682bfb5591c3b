package com.engagesphere.booster.infrastructure.web.dto;

import com.engagesphere.booster.domain.model.RegistrationResult;

public record RegistrationResponse(
        String message,
        UserResponse user,
        EventResponse event
) {
    public static RegistrationResponse fromResult(RegistrationResult result) {
        return new RegistrationResponse(
                "Registered for '" + result.event().name() + "'",
                UserResponse.fromUser(result.user()),
                EventResponse.fromEvent(result.event())
        );
    }
}
