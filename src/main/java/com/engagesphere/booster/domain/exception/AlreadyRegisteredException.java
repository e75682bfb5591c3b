package com.engagesphere.booster.domain.exception;

public class AlreadyRegisteredException extends EngagementException {

    public AlreadyRegisteredException(long userId, long eventId) {
        super("ALREADY_REGISTERED", "User " + userId + " is already registered for event " + eventId);
    }
}
