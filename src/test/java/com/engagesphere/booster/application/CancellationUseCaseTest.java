package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.model.Registration;
import com.engagesphere.booster.domain.port.out.RegistrationRepository;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CancellationUseCaseTest {

    @Mock
    private RegistrationRepository registrationRepository;

    @Mock
    private CommunicationScheduler communicationScheduler;

    private CancellationUseCase cancellationUseCase;

    @BeforeEach
    void setUp() {
        cancellationUseCase = new CancellationUseCase(registrationRepository, communicationScheduler);
    }

    @Test
    void shouldCancelJobsBeforeDeletingRegistration() {
        // Given
        when(registrationRepository.find(1L, 42L))
                .thenReturn(Optional.of(new Registration(5L, 1L, 42L, Instant.parse("2025-03-01T10:00:00Z"))));
        when(communicationScheduler.cancelAll(1L, 42L)).thenReturn(3);

        // When
        boolean cancelled = cancellationUseCase.cancel(1L, 42L);

        // Then
        assertThat(cancelled).isTrue();
        InOrder order = inOrder(communicationScheduler, registrationRepository);
        order.verify(communicationScheduler).cancelAll(1L, 42L);
        order.verify(registrationRepository).delete(1L, 42L);
    }

    @Test
    void shouldReturnFalseWhenNotRegistered() {
        // Given
        when(registrationRepository.find(1L, 42L)).thenReturn(Optional.empty());

        // When
        boolean cancelled = cancellationUseCase.cancel(1L, 42L);

        // Then
        assertThat(cancelled).isFalse();
        verify(registrationRepository, never()).delete(anyLong(), anyLong());
        verifyNoInteractions(communicationScheduler);
    }
}
