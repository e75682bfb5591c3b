package com.engagesphere.booster.domain.exception;

public class EventNotFoundException extends EngagementException {

    public EventNotFoundException(long eventId) {
        super("EVENT_NOT_FOUND", "Event not found: " + eventId);
    }
}
