package com.engagesphere.booster.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record RegistrationRequest(
        @NotNull @Valid CreateUserRequest user,
        @NotNull @JsonProperty("event_id") Long eventId
) {}
