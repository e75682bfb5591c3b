package com.engagesphere.booster.infrastructure.adapter.messaging;

import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.infrastructure.config.MessagingProperties;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailChannelTest {

    private static final User USER = new User(1L, "ada@example.com", "Ada", null, Set.of(), "email", null, false);

    @Mock
    private ObjectProvider<JavaMailSender> mailSenderProvider;

    @Mock
    private JavaMailSender mailSender;

    private MessagingProperties properties;
    private EmailChannel channel;

    @BeforeEach
    void setUp() {
        properties = new MessagingProperties();
        channel = new EmailChannel(mailSenderProvider, properties);
    }

    @Test
    void shouldSendPlainTextMail() {
        // Given
        properties.setMailFrom("events@engagesphere.example");
        when(mailSenderProvider.getIfAvailable()).thenReturn(mailSender);

        // When
        channel.deliver(USER, new OutboundMessage("See you tomorrow", "Hi Ada"));

        // Then
        ArgumentCaptor<SimpleMailMessage> mail = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(mail.capture());
        assertThat(mail.getValue().getFrom()).isEqualTo("events@engagesphere.example");
        assertThat(mail.getValue().getTo()).containsExactly("ada@example.com");
        assertThat(mail.getValue().getSubject()).isEqualTo("See you tomorrow");
        assertThat(mail.getValue().getText()).isEqualTo("Hi Ada");
    }

    @Test
    void shouldSimulateWhenSenderAddressIsMissing() {
        // Given
        when(mailSenderProvider.getIfAvailable()).thenReturn(mailSender);

        // When
        channel.deliver(USER, new OutboundMessage("Subject", "Body"));

        // Then
        verify(mailSender, never()).send(any(SimpleMailMessage.class));
    }
}
