package com.engagesphere.booster.infrastructure.web.dto;

import com.engagesphere.booster.domain.model.Event;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record EventRequest(
        @NotBlank String name,
        String description,
        @NotNull @JsonProperty("event_time") Instant eventTime,
        @JsonProperty("recording_url") String recordingUrl,
        @JsonProperty("image_url") String imageUrl
) {
    public Event toEvent() {
        return new Event(null, name.trim(), description, eventTime, recordingUrl, imageUrl);
    }
}
