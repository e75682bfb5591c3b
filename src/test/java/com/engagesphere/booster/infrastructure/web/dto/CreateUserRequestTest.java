package com.engagesphere.booster.infrastructure.web.dto;

import com.engagesphere.booster.domain.model.User;
import java.util.Locale;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CreateUserRequestTest {

    private Locale defaultLocale;

    @BeforeEach
    void setUp() {
        defaultLocale = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(defaultLocale);
    }

    @Test
    void shouldNormalizeEmailAndInterests() {
        // Given
        CreateUserRequest request = new CreateUserRequest("  Ada@Example.COM ", "Ada", "Engineer",
                Set.of(" Robotics", "AI", " "), "email", null);

        // When
        User user = request.toUser();

        // Then
        assertThat(user.email()).isEqualTo("ada@example.com");
        assertThat(user.interests()).containsExactly("ai", "robotics");
        assertThat(user.admin()).isFalse();
    }

    @Test
    void shouldLowercaseIndependentlyOfDefaultLocale() {
        // Given
        Locale.setDefault(new Locale("tr", "TR"));
        CreateUserRequest request = new CreateUserRequest("IRIS@EXAMPLE.COM", "Iris", null,
                Set.of("IOT"), null, null);

        // When
        User user = request.toUser();

        // Then
        assertThat(user.email()).isEqualTo("iris@example.com");
        assertThat(user.interests()).containsExactly("iot");
    }
}
