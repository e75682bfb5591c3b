package com.engagesphere.booster.application.chat;

import com.engagesphere.booster.domain.model.ChatIntent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes raw extractor output into a {@link ChatIntent}.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>{@code {"action": "register", "event_name": "AI Conference"}}</li>
 *   <li>{@code {"response": "EngageSphere is ..."}}</li>
 * </ul>
 * An object carrying both keys, neither key, or a non-string value is
 * rejected. Rejections decode to {@link #FALLBACK}.
 */
@Component
public class IntentDecoder {

    private static final Logger logger = LoggerFactory.getLogger(IntentDecoder.class);

    static final String ACTION_KEY = "action";
    static final String EVENT_NAME_KEY = "event_name";
    static final String RESPONSE_KEY = "response";

    public static final ChatIntent.Conversational FALLBACK = new ChatIntent.Conversational(
            "I'm sorry, I had a little trouble understanding that. Could you please rephrase?");

    private final ObjectMapper objectMapper;

    public IntentDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ChatIntent decode(String raw) {
        if (raw == null || raw.isBlank()) {
            logger.warn("Intent extractor returned empty output");
            return FALLBACK;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(raw));
        } catch (JsonProcessingException e) {
            logger.warn("Intent extractor returned invalid JSON: {}", raw);
            return FALLBACK;
        }

        if (root == null || !root.isObject()) {
            logger.warn("Intent extractor returned a non-object: {}", raw);
            return FALLBACK;
        }

        boolean hasAction = root.has(ACTION_KEY);
        boolean hasResponse = root.has(RESPONSE_KEY);

        if (hasAction && !hasResponse) {
            return decodeAction(root, raw);
        }
        if (hasResponse && !hasAction) {
            JsonNode response = root.get(RESPONSE_KEY);
            if (response.isTextual()) {
                return new ChatIntent.Conversational(response.asText());
            }
        }

        logger.warn("Intent extractor output matches no known shape: {}", raw);
        return FALLBACK;
    }

    private ChatIntent decodeAction(JsonNode root, String raw) {
        JsonNode action = root.get(ACTION_KEY);
        if (!action.isTextual() || action.asText().isBlank()) {
            logger.warn("Intent action is not a string: {}", raw);
            return FALLBACK;
        }

        String eventName = null;
        JsonNode eventNode = root.get(EVENT_NAME_KEY);
        if (eventNode != null && !eventNode.isNull()) {
            if (!eventNode.isTextual()) {
                logger.warn("Intent event_name is not a string: {}", raw);
                return FALLBACK;
            }
            eventName = eventNode.asText().trim();
        }

        return new ChatIntent.Action(action.asText().trim(), eventName);
    }

    private static String stripCodeFence(String raw) {
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.trim();
    }
}
