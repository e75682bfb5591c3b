package com.engagesphere.booster.application.chat;

import com.engagesphere.booster.application.CancelRegistration;
import com.engagesphere.booster.application.FindRegistrations;
import com.engagesphere.booster.application.ManageEvents;
import com.engagesphere.booster.application.RegisterForEvent;
import com.engagesphere.booster.domain.exception.AlreadyRegisteredException;
import com.engagesphere.booster.domain.exception.EventNotFoundException;
import com.engagesphere.booster.domain.model.ChatIntent;
import com.engagesphere.booster.domain.model.Event;
import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.domain.port.out.IntentExtractor;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves chat queries into intents and runs the matching account action.
 */
@Service
public class ChatDispatcher implements AnswerChatQuery {

    private static final Logger logger = LoggerFactory.getLogger(ChatDispatcher.class);

    static final String REGISTER = "register";
    static final String CANCEL = "cancel";
    static final String LIST_REGISTRATIONS = "list_registrations";

    static final String LOGIN_REQUIRED = "Please log in to register, cancel or list your events.";
    static final String UNKNOWN_ACTION = "I'm not sure how to do that yet.";
    static final String NO_UPCOMING_REGISTRATIONS = "You are not registered for any upcoming events.";
    static final String MISSING_EVENT_NAME = "Which event do you mean? Please include the event name.";

    private final IntentExtractor intentExtractor;
    private final IntentDecoder intentDecoder;
    private final ChatContextBuilder contextBuilder;
    private final ManageEvents manageEvents;
    private final RegisterForEvent registerForEvent;
    private final CancelRegistration cancelRegistration;
    private final FindRegistrations findRegistrations;

    public ChatDispatcher(IntentExtractor intentExtractor,
                          IntentDecoder intentDecoder,
                          ChatContextBuilder contextBuilder,
                          ManageEvents manageEvents,
                          RegisterForEvent registerForEvent,
                          CancelRegistration cancelRegistration,
                          FindRegistrations findRegistrations) {
        this.intentExtractor = intentExtractor;
        this.intentDecoder = intentDecoder;
        this.contextBuilder = contextBuilder;
        this.manageEvents = manageEvents;
        this.registerForEvent = registerForEvent;
        this.cancelRegistration = cancelRegistration;
        this.findRegistrations = findRegistrations;
    }

    @Override
    public String answer(String query, String context, Optional<User> currentUser) {
        String effectiveContext = context == null || context.isBlank() ? contextBuilder.build() : context;
        ChatIntent intent = resolve(query, effectiveContext);
        return dispatch(intent, currentUser);
    }

    public ChatIntent resolve(String query, String context) {
        logger.info("Resolving chat query: '{}'", query);
        String raw;
        try {
            raw = intentExtractor.extract(query, context);
        } catch (RuntimeException e) {
            logger.error("Intent extraction failed", e);
            return IntentDecoder.FALLBACK;
        }
        ChatIntent intent = intentDecoder.decode(raw);
        logger.debug("Resolved intent {}", intent);
        return intent;
    }

    public String dispatch(ChatIntent intent, Optional<User> currentUser) {
        if (intent instanceof ChatIntent.Conversational conversational) {
            return conversational.text();
        }

        ChatIntent.Action action = (ChatIntent.Action) intent;
        if (currentUser.isEmpty()) {
            logger.info("Refusing chat action '{}' for anonymous user", action.action());
            return LOGIN_REQUIRED;
        }
        User user = currentUser.get();

        switch (action.action().toLowerCase(Locale.ROOT)) {
            case LIST_REGISTRATIONS:
                return listRegistrations(user);
            case REGISTER:
                return withEvent(action, event -> register(user, event));
            case CANCEL:
                return withEvent(action, event -> cancel(user, event));
            default:
                logger.info("Unknown chat action '{}'", action.action());
                return UNKNOWN_ACTION;
        }
    }

    private String listRegistrations(User user) {
        List<Event> upcoming = findRegistrations.upcomingFor(user.id());
        if (upcoming.isEmpty()) {
            return NO_UPCOMING_REGISTRATIONS;
        }

        StringBuilder reply = new StringBuilder("You are registered for the following upcoming events:");
        for (Event event : upcoming) {
            reply.append("\n- ").append(event.name())
                    .append(" (").append(ChatContextBuilder.format(event)).append(")");
        }
        return reply.toString();
    }

    private String register(User user, Event event) {
        try {
            registerForEvent.register(user, event.id());
            return "You're all set! You are now registered for '" + event.name() + "'.";
        } catch (AlreadyRegisteredException e) {
            return "You are already registered for '" + event.name() + "'.";
        } catch (EventNotFoundException e) {
            return notFound(event.name());
        }
    }

    private String cancel(User user, Event event) {
        if (cancelRegistration.cancel(user.id(), event.id())) {
            return "Your registration for '" + event.name() + "' has been cancelled.";
        }
        return "You are not registered for '" + event.name() + "'.";
    }

    private String withEvent(ChatIntent.Action action, Function<Event, String> reply) {
        if (action.eventName() == null || action.eventName().isBlank()) {
            return MISSING_EVENT_NAME;
        }
        return findEventByName(action.eventName())
                .map(reply::apply)
                .orElseGet(() -> notFound(action.eventName()));
    }

    /**
     * Case-insensitive substring match on event names; the earliest event wins
     */
    Optional<Event> findEventByName(String eventName) {
        String needle = eventName.toLowerCase(Locale.ROOT);
        return manageEvents.findAll().stream()
                .filter(event -> event.name() != null && event.name().toLowerCase(Locale.ROOT).contains(needle))
                .min(Comparator.comparing(Event::eventTime));
    }

    private static String notFound(String eventName) {
        return "I couldn't find an event named '" + eventName + "'.";
    }
}
