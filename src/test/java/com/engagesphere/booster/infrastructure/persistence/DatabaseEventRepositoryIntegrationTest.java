package com.engagesphere.booster.infrastructure.persistence;

import com.engagesphere.booster.domain.model.Event;
import com.engagesphere.booster.domain.model.User;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DatabaseEventRepositoryIntegrationTest extends PostgresRepositoryTestSupport {

    private DatabaseEventRepository repository;
    private DatabaseUserRepository userRepository;
    private DatabaseRegistrationRepository registrationRepository;

    @BeforeEach
    void setUp() {
        repository = new DatabaseEventRepository(jdbcTemplate);
        userRepository = new DatabaseUserRepository(jdbcTemplate);
        registrationRepository = new DatabaseRegistrationRepository(jdbcTemplate);
    }

    @Test
    void shouldSaveAndFindEventWithUtcInstant() {
        // Given
        Instant start = Instant.parse("2030-05-01T16:00:00Z");

        // When
        Event saved = repository.save(new Event(null, "AI Conference", "Explore the future of AI", start,
                "https://video.example.com/ai", "https://img.example.com/ai.png"));

        // Then
        assertThat(saved.id()).isNotNull();
        assertThat(repository.findById(saved.id())).hasValueSatisfying(found -> {
            assertThat(found.name()).isEqualTo("AI Conference");
            assertThat(found.eventTime()).isEqualTo(start);
            assertThat(found.recordingUrl()).isEqualTo("https://video.example.com/ai");
        });
    }

    @Test
    void shouldReturnEmptyForUnknownId() {
        assertThat(repository.findById(999_999L)).isEmpty();
    }

    @Test
    void shouldListEventsByStartTime() {
        // Given
        repository.save(event("Later", "2030-06-01T10:00:00Z"));
        repository.save(event("Sooner", "2030-05-01T10:00:00Z"));

        // When
        List<Event> events = repository.findAll();

        // Then
        assertThat(events).extracting(Event::name).containsExactly("Sooner", "Later");
    }

    @Test
    void shouldFindEventsUserIsRegisteredFor() {
        // Given
        User ada = userRepository.save(user("ada@example.com"));
        Event first = repository.save(event("First", "2030-05-01T10:00:00Z"));
        Event second = repository.save(event("Second", "2030-04-01T10:00:00Z"));
        repository.save(event("Not registered", "2030-03-01T10:00:00Z"));
        registrationRepository.create(ada.id(), first.id(), Instant.now());
        registrationRepository.create(ada.id(), second.id(), Instant.now());

        // When
        List<Event> registered = repository.findRegisteredBy(ada.id());

        // Then
        assertThat(registered).extracting(Event::name).containsExactly("Second", "First");
    }

    @Test
    void shouldDeleteEventTogetherWithRegistrations() {
        // Given
        User ada = userRepository.save(user("ada@example.com"));
        Event event = repository.save(event("AI Conference", "2030-05-01T10:00:00Z"));
        registrationRepository.create(ada.id(), event.id(), Instant.now());

        // When
        repository.deleteById(event.id());

        // Then
        assertThat(repository.findById(event.id())).isEmpty();
        assertThat(registrationRepository.findByEventId(event.id())).isEmpty();
        assertThat(userRepository.findById(ada.id())).isPresent();
    }

    private static Event event(String name, String start) {
        return new Event(null, name, null, Instant.parse(start), null, null);
    }

    private static User user(String email) {
        return new User(null, email, "Ada", null, Set.of(), "email", null, false);
    }
}
