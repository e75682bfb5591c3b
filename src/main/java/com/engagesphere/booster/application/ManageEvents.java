package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.model.Event;
import java.util.List;
import java.util.Optional;

public interface ManageEvents {

    Event create(Event event);

    Optional<Event> findById(long eventId);

    List<Event> findAll();

    /**
     * Events whose start time is now or later, soonest first
     */
    List<Event> findUpcoming();

    /**
     * Deletes the event after cancelling every registration on it.
     *
     * @return number of registrations that were cancelled
     * @throws com.engagesphere.booster.domain.exception.EventNotFoundException if the event does not exist
     */
    int delete(long eventId);
}
