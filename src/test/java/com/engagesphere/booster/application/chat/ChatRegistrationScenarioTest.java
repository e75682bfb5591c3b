package com.engagesphere.booster.application.chat;

import com.engagesphere.booster.application.CancelRegistration;
import com.engagesphere.booster.application.CommunicationScheduler;
import com.engagesphere.booster.application.FindRegistrations;
import com.engagesphere.booster.application.ManageEvents;
import com.engagesphere.booster.application.RegistrationUseCase;
import com.engagesphere.booster.application.RegistrationWriter;
import com.engagesphere.booster.domain.InterestExtractor;
import com.engagesphere.booster.domain.exception.AlreadyRegisteredException;
import com.engagesphere.booster.domain.model.Event;
import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.domain.port.out.DeliveryLedger;
import com.engagesphere.booster.domain.port.out.EventRepository;
import com.engagesphere.booster.domain.port.out.IntentExtractor;
import com.engagesphere.booster.domain.port.out.MessageComposer;
import com.engagesphere.booster.domain.port.out.MessageSender;
import com.engagesphere.booster.domain.port.out.RegistrationRepository;
import com.engagesphere.booster.domain.port.out.UserRepository;
import com.engagesphere.booster.domain.scheduling.CommunicationPlanner;
import com.engagesphere.booster.infrastructure.scheduler.InMemoryJobScheduler;
import com.engagesphere.booster.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * "Sign me up" through the dispatcher, the registration workflow and a real
 * in-memory scheduler.
 */
@ExtendWith(MockitoExtension.class)
class ChatRegistrationScenarioTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");
    private static final String QUERY = "sign me up for the AI Conference";
    private static final String CONTEXT = "Upcoming events: AI Conference";

    @Mock
    private IntentExtractor intentExtractor;

    @Mock
    private ChatContextBuilder contextBuilder;

    @Mock
    private ManageEvents manageEvents;

    @Mock
    private CancelRegistration cancelRegistration;

    @Mock
    private FindRegistrations findRegistrations;

    @Mock
    private EventRepository eventRepository;

    @Mock
    private RegistrationRepository registrationRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private MessageComposer messageComposer;

    @Mock
    private MessageSender messageSender;

    @Mock
    private DeliveryLedger deliveryLedger;

    private InMemoryJobScheduler jobScheduler;
    private ChatDispatcher dispatcher;
    private Event event;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        jobScheduler = new InMemoryJobScheduler(clock, Runnable::run, Duration.ofSeconds(1), "chat-test-scheduler");
        CommunicationScheduler communicationScheduler = new CommunicationScheduler(new CommunicationPlanner(),
                jobScheduler, clock, userRepository, eventRepository, messageComposer, messageSender, deliveryLedger);
        RegistrationUseCase registrationUseCase = new RegistrationUseCase(eventRepository, registrationRepository,
                new RegistrationWriter(userRepository, registrationRepository), new InterestExtractor(), messageComposer, messageSender, communicationScheduler, clock);

        dispatcher = new ChatDispatcher(intentExtractor, new IntentDecoder(new ObjectMapper()), contextBuilder,
                manageEvents, registrationUseCase, cancelRegistration, findRegistrations);
        event = new Event(42L, "AI Conference", "Explore the future of AI", NOW.plus(Duration.ofDays(5)), null, null);
    }

    @Test
    void shouldRegisterAuthenticatedUserAndScheduleFiveJobs() {
        // Given
        User user = new User(1L, "ada@example.com", "Ada", "Engineer", Set.of(), "email", null, false);
        when(intentExtractor.extract(QUERY, CONTEXT))
                .thenReturn("{\"action\": \"register\", \"event_name\": \"AI Conference\"}");
        when(manageEvents.findAll()).thenReturn(List.of(event));
        when(eventRepository.findById(42L)).thenReturn(Optional.of(event));
        when(registrationRepository.find(1L, 42L)).thenReturn(Optional.empty());
        when(messageComposer.compose(any(), any(), any())).thenReturn("Subject: Welcome\n\nHello");

        // When
        String reply = dispatcher.answer(QUERY, CONTEXT, Optional.of(user));

        // Then
        assertThat(reply).isEqualTo("You're all set! You are now registered for 'AI Conference'.");
        assertThat(jobScheduler.pendingJobIds()).hasSize(5);
    }

    @Test
    void shouldReplyAlreadyRegisteredWhenConcurrentRequestInsertedFirst() {
        // Given
        User user = new User(1L, "ada@example.com", "Ada", "Engineer", Set.of(), "email", null, false);
        when(intentExtractor.extract(QUERY, CONTEXT))
                .thenReturn("{\"action\": \"register\", \"event_name\": \"AI Conference\"}");
        when(manageEvents.findAll()).thenReturn(List.of(event));
        when(eventRepository.findById(42L)).thenReturn(Optional.of(event));
        when(registrationRepository.find(1L, 42L)).thenReturn(Optional.empty());
        when(registrationRepository.create(eq(1L), eq(42L), any())).thenThrow(new AlreadyRegisteredException(1L, 42L));

        // When
        String reply = dispatcher.answer(QUERY, CONTEXT, Optional.of(user));

        // Then
        assertThat(reply).isEqualTo("You are already registered for 'AI Conference'.");
        assertThat(jobScheduler.pendingJobIds()).isEmpty();
        verifyNoInteractions(messageSender);
    }

    @Test
    void shouldRefuseAnonymousUserAndScheduleNothing() {
        // Given
        when(intentExtractor.extract(QUERY, CONTEXT))
                .thenReturn("{\"action\": \"register\", \"event_name\": \"AI Conference\"}");

        // When
        String reply = dispatcher.answer(QUERY, CONTEXT, Optional.empty());

        // Then
        assertThat(reply).isEqualTo("Please log in to register, cancel or list your events.");
        assertThat(jobScheduler.pendingJobIds()).isEmpty();
        verifyNoInteractions(registrationRepository, messageSender);
    }

    @Test
    void shouldReplyWithClarificationOnMalformedExtractorOutput() {
        // Given
        when(intentExtractor.extract(QUERY, CONTEXT)).thenReturn("Sure! I will register you {action: register");

        // When
        String reply = dispatcher.answer(QUERY, CONTEXT, Optional.empty());

        // Then
        assertThat(reply).isEqualTo("I'm sorry, I had a little trouble understanding that. Could you please rephrase?");
        assertThat(jobScheduler.pendingJobIds()).isEmpty();
    }
}
