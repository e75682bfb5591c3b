package com.engagesphere.booster.infrastructure.adapter.messaging;

import com.engagesphere.booster.domain.model.ContactMethod;
import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.infrastructure.config.MessagingProperties;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import java.io.UncheckedIOException;
import okhttp3.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class WhatsAppChannel implements DeliveryChannel {

    private static final Logger logger = LoggerFactory.getLogger(WhatsAppChannel.class);

    private static final String WHATSAPP_PREFIX = "whatsapp:";

    private final TwilioMessagesApi twilioMessagesApi;
    private final MessagingProperties properties;

    public WhatsAppChannel(TwilioMessagesApi twilioMessagesApi, MessagingProperties properties) {
        this.twilioMessagesApi = twilioMessagesApi;
        this.properties = properties;
    }

    @Override
    public ContactMethod method() {
        return ContactMethod.WHATSAPP;
    }

    @Override
    @Retry(name = "whatsapp")
    public void deliver(User recipient, OutboundMessage message) {
        String text = "*" + message.subject() + "*\n\n" + message.body();
        MessagingProperties.Twilio twilio = properties.getTwilio();

        if (!twilio.isConfigured() || recipient.phoneNumber() == null || recipient.phoneNumber().isBlank()) {
            logger.warn("Twilio is not configured or user {} has no phone number. Simulating WhatsApp message",
                    recipient.id());
            logger.info("[SIMULATED] WhatsApp to {} | {}", recipient.phoneNumber(), message.subject());
            return;
        }

        try {
            var response = twilioMessagesApi.createMessage(
                    Credentials.basic(twilio.getAccountSid(), twilio.getAuthToken()),
                    twilio.getAccountSid(),
                    withPrefix(twilio.getWhatsappFrom()),
                    withPrefix(recipient.phoneNumber()),
                    text).execute();

            if (!response.isSuccessful()) {
                throw new IllegalStateException("Twilio rejected WhatsApp message with HTTP " + response.code());
            }

            String sid = response.body() != null ? response.body().sid() : null;
            logger.info("WhatsApp message sent to {} (SID: {})", recipient.phoneNumber(), sid);
        } catch (IOException e) {
            throw new UncheckedIOException("Twilio unreachable", e);
        }
    }

    static String withPrefix(String number) {
        return number.startsWith(WHATSAPP_PREFIX) ? number : WHATSAPP_PREFIX + number;
    }
}
