package com.engagesphere.booster.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EventDeletionResponse(
        @JsonProperty("event_id") long eventId,
        @JsonProperty("cancelled_registrations") int cancelledRegistrations
) {}
