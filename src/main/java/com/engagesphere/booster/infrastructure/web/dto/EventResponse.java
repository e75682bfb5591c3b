package com.engagesphere.booster.infrastructure.web.dto;

import com.engagesphere.booster.domain.model.Event;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record EventResponse(
        Long id,
        String name,
        String description,
        @JsonProperty("event_time") Instant eventTime,
        @JsonProperty("recording_url") String recordingUrl,
        @JsonProperty("image_url") String imageUrl
) {
    public static EventResponse fromEvent(Event event) {
        return new EventResponse(
                event.id(),
                event.name(),
                event.description(),
                event.eventTime(),
                event.recordingUrl(),
                event.imageUrl()
        );
    }

    public static List<EventResponse> fromEvents(List<Event> events) {
        return events.stream()
                .map(EventResponse::fromEvent)
                .toList();
    }
}
