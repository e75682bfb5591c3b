package com.engagesphere.booster.application;

/**
 * Removes a registration and every communication still pending for it.
 */
public interface CancelRegistration {

    /**
     * @return false if the user was not registered for the event
     */
    boolean cancel(long userId, long eventId);
}
