package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.InterestExtractor;
import com.engagesphere.booster.domain.exception.AlreadyRegisteredException;
import com.engagesphere.booster.domain.exception.EventNotFoundException;
import com.engagesphere.booster.domain.model.Event;
import com.engagesphere.booster.domain.model.MessageType;
import com.engagesphere.booster.domain.model.RegistrationResult;
import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.domain.port.out.EventRepository;
import com.engagesphere.booster.domain.port.out.MessageComposer;
import com.engagesphere.booster.domain.port.out.MessageSender;
import com.engagesphere.booster.domain.port.out.RegistrationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RegistrationUseCase implements RegisterForEvent, FindRegistrations {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationUseCase.class);

    private final EventRepository eventRepository;
    private final RegistrationRepository registrationRepository;
    private final RegistrationWriter registrationWriter;
    private final InterestExtractor interestExtractor;
    private final MessageComposer messageComposer;
    private final MessageSender messageSender;
    private final CommunicationScheduler communicationScheduler;
    private final Clock clock;

    public RegistrationUseCase(EventRepository eventRepository,
                               RegistrationRepository registrationRepository,
                               RegistrationWriter registrationWriter,
                               InterestExtractor interestExtractor,
                               MessageComposer messageComposer,
                               MessageSender messageSender,
                               CommunicationScheduler communicationScheduler,
                               Clock clock) {
        this.eventRepository = eventRepository;
        this.registrationRepository = registrationRepository;
        this.registrationWriter = registrationWriter;
        this.interestExtractor = interestExtractor;
        this.messageComposer = messageComposer;
        this.messageSender = messageSender;
        this.communicationScheduler = communicationScheduler;
        this.clock = clock;
    }

    @Override
    public RegistrationResult register(User user, long eventId) {
        logger.info("Registering {} for event {}", user.email(), eventId);

        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));

        if (registrationRepository.find(user.id(), eventId).isPresent()) {
            logger.warn("User {} is already registered for event {}", user.id(), eventId);
            throw new AlreadyRegisteredException(user.id(), eventId);
        }

        SortedSet<String> interests = interestExtractor.merge(user.interests(), event);

        // Must be durable before anything is sent or scheduled
        registrationWriter.write(user.id(), eventId, interests, clock.instant());
        User updatedUser = user.withInterests(interests);

        sendWelcome(updatedUser, event);

        try {
            communicationScheduler.scheduleAll(updatedUser, event);
        } catch (RuntimeException e) {
            logger.error("Failed to schedule communications for user {} and event {}", user.id(), eventId, e);
        }

        return new RegistrationResult(updatedUser, event);
    }

    @Override
    public List<Event> upcomingFor(long userId) {
        Instant now = clock.instant();
        return eventRepository.findRegisteredBy(userId).stream()
                .filter(event -> !event.eventTime().isBefore(now))
                .toList();
    }

    private void sendWelcome(User user, Event event) {
        try {
            String content = messageComposer.compose(user, event, MessageType.WELCOME);
            messageSender.send(user.id(), content);
        } catch (RuntimeException e) {
            logger.error("Welcome message for user {} and event {} was not sent", user.id(), event.id(), e);
        }
    }
}
