package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.model.Event;
import java.util.List;

public interface FindRegistrations {

    /**
     * Events the user is registered for that have not started yet, soonest first
     */
    List<Event> upcomingFor(long userId);
}
