package com.engagesphere.booster.infrastructure.adapter.llm;

import com.engagesphere.booster.domain.model.Event;
import com.engagesphere.booster.domain.model.MessageType;
import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.domain.port.out.MessageComposer;
import com.engagesphere.booster.infrastructure.config.LlmProperties;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Personalised message content from the text-generation service, with a
 * plain template when the service fails or answers off-format.
 */
@Component
public class LlmMessageComposer implements MessageComposer {

    private static final Logger logger = LoggerFactory.getLogger(LlmMessageComposer.class);

    private static final String SUBJECT_PREFIX = "Subject:";

    private static final DateTimeFormatter EVENT_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private static final String PROMPT_TEMPLATE = """
            <|system|>You are a friendly and professional event assistant. Your task is to generate the \
            content for a '%1$s' email based on the provided details. The output must strictly follow the \
            example format, starting with 'Subject:'.</s>
            <|user|>

            ### Example Output Format
            Subject: Your Subject Here

            Hi [User Name],

            This is the body of the email.

            Best,
            The Event Team

            ### User Details
            - Name: %2$s
            - Job Title: %3$s
            - Interests: %4$s

            ### Event Details
            - Name: %5$s
            - Description: %6$s
            - Time: %7$s

            ### Instructions
            - For a 'welcome' message, be warm, confirm their registration, and mention how the event relates to their interests or job title.
            - For a 'content_preview' message, generate excitement by giving a sneak peek of the event, like mentioning a key topic.
            - For a 'reminder_24h' or 'reminder_1h' message, build excitement and provide a placeholder for the event link like [EVENT_LINK].
            - For an 'event_starting' message, be energetic and concise. Announce that the event is starting now and provide the event link placeholder [EVENT_LINK].
            - For a 'follow_up' message, thank them for attending and provide the recording link: %8$s.
            <|assistant|>
            """;

    private final TextGenerationClient textGenerationClient;
    private final LlmProperties properties;

    public LlmMessageComposer(TextGenerationClient textGenerationClient, LlmProperties properties) {
        this.textGenerationClient = textGenerationClient;
        this.properties = properties;
    }

    @Override
    public String compose(User user, Event event, MessageType messageType) {
        if (!properties.isEnabled()) {
            logger.debug("Text generation disabled, using {} template for {}", messageType.value(), user.email());
            return fallback(user, event, messageType);
        }
        logger.info("Generating {} content for {}", messageType.value(), user.email());
        try {
            String generated = textGenerationClient.generate(buildPrompt(user, event, messageType),
                    TextGenerationRequest.Parameters.sampled(properties.getMaxNewTokens(), properties.getTemperature()));

            if (!generated.startsWith(SUBJECT_PREFIX)) {
                logger.warn("Generated {} content has no subject line, using template", messageType.value());
                return fallback(user, event, messageType);
            }
            return generated;
        } catch (RuntimeException e) {
            logger.warn("Content generation failed for {}, using template: {}", messageType.value(), e.getMessage());
            return fallback(user, event, messageType);
        }
    }

    String buildPrompt(User user, Event event, MessageType messageType) {
        return PROMPT_TEMPLATE.formatted(
                messageType.value(),
                user.name(),
                valueOrNotProvided(user.jobTitle()),
                user.interests().isEmpty() ? "Not provided" : String.join(", ", user.interests()),
                event.name(),
                valueOrNotProvided(event.description()),
                EVENT_TIME_FORMAT.format(event.eventTime()),
                valueOrNotProvided(event.recordingUrl()));
    }

    static String fallback(User user, Event event, MessageType messageType) {
        String subject = "Regarding " + event.name();
        String body = "Hi " + user.name() + ",\n\n"
                + "This is a " + messageType.value() + " message for the event '" + event.name() + "'.\n\n"
                + "Event Time: " + EVENT_TIME_FORMAT.format(event.eventTime()) + "\n\n"
                + "Best,\nEvent Team";
        return SUBJECT_PREFIX + " " + subject + "\n\n" + body;
    }

    private static String valueOrNotProvided(String value) {
        return value == null || value.isBlank() ? "Not provided" : value;
    }
}
