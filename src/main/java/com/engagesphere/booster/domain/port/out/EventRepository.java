package com.engagesphere.booster.domain.port.out;

import com.engagesphere.booster.domain.model.Event;
import java.util.List;
import java.util.Optional;

/**
 * Repository port for the Event aggregate
 */
public interface EventRepository {

    Optional<Event> findById(long eventId);

    /**
     * All events ordered by start time
     */
    List<Event> findAll();

    /**
     * Events the given user holds a registration for, ordered by start time
     */
    List<Event> findRegisteredBy(long userId);

    Event save(Event event);

    /**
     * Removes the event together with any registration rows still pointing at it
     */
    void deleteById(long eventId);
}
