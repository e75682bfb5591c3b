package com.engagesphere.booster.infrastructure.persistence;

import com.engagesphere.booster.domain.exception.AlreadyRegisteredException;
import com.engagesphere.booster.domain.model.Event;
import com.engagesphere.booster.domain.model.Registration;
import com.engagesphere.booster.domain.model.User;
import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseRegistrationRepositoryIntegrationTest extends PostgresRepositoryTestSupport {

    private static final Instant REGISTERED_AT = Instant.parse("2025-03-10T09:00:00Z");

    private DatabaseRegistrationRepository repository;
    private User user;
    private Event event;

    @BeforeEach
    void setUp() {
        repository = new DatabaseRegistrationRepository(jdbcTemplate);
        user = new DatabaseUserRepository(jdbcTemplate)
                .save(new User(null, "ada@example.com", "Ada", null, Set.of(), "email", null, false));
        event = new DatabaseEventRepository(jdbcTemplate)
                .save(new Event(null, "AI Conference", null, Instant.parse("2030-05-01T10:00:00Z"), null, null));
    }

    @Test
    void shouldCreateAndFindRegistration() {
        // When
        Registration created = repository.create(user.id(), event.id(), REGISTERED_AT);

        // Then
        assertThat(created.id()).isNotNull();
        assertThat(repository.find(user.id(), event.id())).hasValueSatisfying(found -> {
            assertThat(found.registrationTime()).isEqualTo(REGISTERED_AT);
            assertThat(found.userId()).isEqualTo(user.id());
        });
        assertThat(repository.findByEventId(event.id())).hasSize(1);
    }

    @Test
    void shouldRejectSecondRegistrationForSamePair() {
        // Given
        repository.create(user.id(), event.id(), REGISTERED_AT);

        // When & Then
        assertThatThrownBy(() -> repository.create(user.id(), event.id(), REGISTERED_AT))
                .isInstanceOf(AlreadyRegisteredException.class)
                .hasMessageContaining("already registered");
        assertThat(repository.findByEventId(event.id())).hasSize(1);
    }

    @Test
    void shouldReportWhetherDeleteRemovedARow() {
        // Given
        repository.create(user.id(), event.id(), REGISTERED_AT);

        // Then
        assertThat(repository.delete(user.id(), event.id())).isTrue();
        assertThat(repository.delete(user.id(), event.id())).isFalse();
        assertThat(repository.find(user.id(), event.id())).isEmpty();
    }
}
