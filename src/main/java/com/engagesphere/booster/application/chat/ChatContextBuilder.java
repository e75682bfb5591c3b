package com.engagesphere.booster.application.chat;

import com.engagesphere.booster.application.ManageEvents;
import com.engagesphere.booster.domain.model.Event;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Default chat context: what the platform is, plus its upcoming events.
 */
@Component
public class ChatContextBuilder {

    static final String INTRODUCTION =
            "EngageSphere is an AI-powered agent designed to boost engagement for webinars and events. "
                    + "Registered users receive a welcome message, a content preview, reminders 24 hours "
                    + "and 1 hour before the event, a nudge when it starts and a follow-up afterwards.";

    private static final DateTimeFormatter EVENT_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final ManageEvents manageEvents;

    public ChatContextBuilder(ManageEvents manageEvents) {
        this.manageEvents = manageEvents;
    }

    public String build() {
        List<Event> upcoming = manageEvents.findUpcoming();

        StringBuilder context = new StringBuilder(INTRODUCTION);
        if (upcoming.isEmpty()) {
            context.append("\n\nThere are no upcoming events.");
            return context.toString();
        }

        context.append("\n\nUpcoming events:");
        for (Event event : upcoming) {
            context.append("\n- ").append(event.name())
                    .append(" (").append(format(event)).append(")");
            if (event.description() != null && !event.description().isBlank()) {
                context.append(": ").append(event.description());
            }
        }
        return context.toString();
    }

    static String format(Event event) {
        return EVENT_TIME_FORMAT.format(event.eventTime());
    }
}
