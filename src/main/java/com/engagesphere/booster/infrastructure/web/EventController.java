package com.engagesphere.booster.infrastructure.web;

import com.engagesphere.booster.application.ManageEvents;
import com.engagesphere.booster.domain.exception.EventNotFoundException;
import com.engagesphere.booster.infrastructure.web.dto.EventDeletionResponse;
import com.engagesphere.booster.infrastructure.web.dto.EventRequest;
import com.engagesphere.booster.infrastructure.web.dto.EventResponse;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/events")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final ManageEvents manageEvents;
    private final CallerResolver callerResolver;

    public EventController(ManageEvents manageEvents, CallerResolver callerResolver) {
        this.manageEvents = manageEvents;
        this.callerResolver = callerResolver;
    }

    @PostMapping
    public ResponseEntity<EventResponse> createEvent(
            @RequestHeader(value = CallerResolver.USER_ID_HEADER, required = false) Long callerId,
            @Valid @RequestBody EventRequest request
    ) {
        var admin = callerResolver.requireAdmin(callerId);
        logger.info("Admin {} creating event '{}' at {}", admin.id(), request.name(), request.eventTime());

        var event = manageEvents.create(request.toEvent());
        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.fromEvent(event));
    }

    @GetMapping
    public ResponseEntity<List<EventResponse>> listEvents() {
        return ResponseEntity.ok(EventResponse.fromEvents(manageEvents.findAll()));
    }

    @GetMapping("/upcoming")
    public ResponseEntity<List<EventResponse>> listUpcomingEvents() {
        return ResponseEntity.ok(EventResponse.fromEvents(manageEvents.findUpcoming()));
    }

    @GetMapping("/{eventId}")
    public ResponseEntity<EventResponse> getEvent(@PathVariable long eventId) {
        var event = manageEvents.findById(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));
        return ResponseEntity.ok(EventResponse.fromEvent(event));
    }

    @DeleteMapping("/{eventId}")
    public ResponseEntity<EventDeletionResponse> deleteEvent(
            @RequestHeader(value = CallerResolver.USER_ID_HEADER, required = false) Long callerId,
            @PathVariable long eventId
    ) {
        var admin = callerResolver.requireAdmin(callerId);
        logger.info("Admin {} deleting event {}", admin.id(), eventId);

        int cancelled = manageEvents.delete(eventId);
        return ResponseEntity.ok(new EventDeletionResponse(eventId, cancelled));
    }
}
