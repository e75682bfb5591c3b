package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.exception.EventNotFoundException;
import com.engagesphere.booster.domain.model.Event;
import com.engagesphere.booster.domain.model.Registration;
import com.engagesphere.booster.domain.port.out.EventRepository;
import com.engagesphere.booster.domain.port.out.RegistrationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Event lifecycle. There is no edit operation; scheduled jobs never move
 * when an event changes.
 */
@Service
public class EventAdministrationUseCase implements ManageEvents {

    private static final Logger logger = LoggerFactory.getLogger(EventAdministrationUseCase.class);

    private final EventRepository eventRepository;
    private final RegistrationRepository registrationRepository;
    private final CancelRegistration cancelRegistration;
    private final Clock clock;

    public EventAdministrationUseCase(EventRepository eventRepository,
                                      RegistrationRepository registrationRepository,
                                      CancelRegistration cancelRegistration,
                                      Clock clock) {
        this.eventRepository = eventRepository;
        this.registrationRepository = registrationRepository;
        this.cancelRegistration = cancelRegistration;
        this.clock = clock;
    }

    @Override
    public Event create(Event event) {
        Event saved = eventRepository.save(event);
        logger.info("Created event {} '{}' at {}", saved.id(), saved.name(), saved.eventTime());
        return saved;
    }

    @Override
    public Optional<Event> findById(long eventId) {
        return eventRepository.findById(eventId);
    }

    @Override
    public List<Event> findAll() {
        return eventRepository.findAll();
    }

    @Override
    public List<Event> findUpcoming() {
        Instant now = clock.instant();
        return eventRepository.findAll().stream()
                .filter(event -> !event.eventTime().isBefore(now))
                .toList();
    }

    @Override
    public int delete(long eventId) {
        eventRepository.findById(eventId).orElseThrow(() -> new EventNotFoundException(eventId));

        List<Registration> registrations = registrationRepository.findByEventId(eventId);
        int cancelled = 0;
        for (Registration registration : registrations) {
            if (cancelRegistration.cancel(registration.userId(), eventId)) {
                cancelled++;
            }
        }

        eventRepository.deleteById(eventId);
        logger.info("Deleted event {} and cancelled {} registrations", eventId, cancelled);
        return cancelled;
    }
}
