package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.model.RegistrationResult;
import com.engagesphere.booster.domain.model.User;

/**
 * Registers a user for an event and starts the engagement timeline.
 */
public interface RegisterForEvent {

    /**
     * @param user    persisted user (must carry an id)
     * @param eventId event to register for
     * @return the user with updated interests, and the event
     * @throws com.engagesphere.booster.domain.exception.EventNotFoundException if the event does not exist
     * @throws com.engagesphere.booster.domain.exception.AlreadyRegisteredException if the pair is already registered
     */
    RegistrationResult register(User user, long eventId);
}
