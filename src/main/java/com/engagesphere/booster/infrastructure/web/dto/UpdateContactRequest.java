package com.engagesphere.booster.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record UpdateContactRequest(
        @NotBlank @JsonProperty("preferred_contact_method") String preferredContactMethod,
        @JsonProperty("phone_number") String phoneNumber
) {}
