package com.engagesphere.booster.infrastructure.adapter.llm;

import com.engagesphere.booster.domain.port.out.IntentExtractor;
import com.engagesphere.booster.infrastructure.config.LlmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Asks the text-generation service to act as a function-calling agent and
 * answer with a single JSON object. Output is returned raw; validation
 * happens in the chat layer.
 */
@Component
public class LlmIntentExtractor implements IntentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(LlmIntentExtractor.class);

    static final String UNAVAILABLE_RESPONSE =
            "{\"response\": \"I'm sorry, but I'm having trouble connecting to my brain right now. "
                    + "Please try again in a moment.\"}";

    private static final String TRUNCATION_MARKER = "\n... (context truncated)";

    private static final String PROMPT_TEMPLATE = """
            <|system|>You are the AI assistant for "EngageSphere". Your primary role is to help users by either \
            answering their questions or performing actions for them. Analyze the user's query and the provided \
            context, then choose one of the following two paths:

            1.  **Function Call**: If the user's intent is to perform an action like registering for an event, \
            canceling a registration, or listing their events, you MUST return a JSON object with the key "action" \
            and other relevant parameters.
                - The possible actions are: "register", "cancel", "list_registrations".
                - For "register" and "cancel", you MUST also include an "event_name" key with the name of the event extracted from the query.
                - Example 1 (Register): User asks "Can you sign me up for the AI conference?", you return {"action": "register", "event_name": "AI Conference"}
                - Example 2 (Cancel): User asks "I can't make it to the Data Summit, please cancel it.", you return {"action": "cancel", "event_name": "Data Summit"}
                - Example 3 (List): User asks "What am I registered for?", you return {"action": "list_registrations"}

            2.  **Conversational Response**: If the user's query is a general question, a greeting, or anything that \
            doesn't map to a function call, you MUST return a JSON object with a single key "response" containing your \
            friendly, conversational answer. Base your answer ONLY on the provided "Project Context". If the answer \
            isn't in the context, say you don't have that information.

            You must only return a single, valid JSON object and nothing else.
            </s>
            <|user|>

            ### Project Context
            %s

            ### User Question
            %s
            <|assistant|>
            """;

    private final TextGenerationClient textGenerationClient;
    private final LlmProperties properties;

    public LlmIntentExtractor(TextGenerationClient textGenerationClient, LlmProperties properties) {
        this.textGenerationClient = textGenerationClient;
        this.properties = properties;
    }

    @Override
    public String extract(String query, String context) {
        if (!properties.isEnabled()) {
            logger.debug("Text generation disabled, skipping chatbot response for query: '{}'", query);
            return UNAVAILABLE_RESPONSE;
        }
        logger.info("Generating chatbot response for query: '{}'", query);
        try {
            return textGenerationClient.generate(buildPrompt(query, context),
                    TextGenerationRequest.Parameters.greedy(properties.getMaxIntentTokens()));
        } catch (RuntimeException e) {
            logger.error("Chatbot generation failed: {}", e.getMessage());
            return UNAVAILABLE_RESPONSE;
        }
    }

    String buildPrompt(String query, String context) {
        return PROMPT_TEMPLATE.formatted(truncate(context), query);
    }

    String truncate(String context) {
        if (context == null) {
            return "";
        }
        int limit = properties.getMaxContextChars();
        if (context.length() <= limit) {
            return context;
        }
        return context.substring(0, limit) + TRUNCATION_MARKER;
    }
}
