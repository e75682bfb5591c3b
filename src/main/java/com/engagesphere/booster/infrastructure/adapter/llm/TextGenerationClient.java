package com.engagesphere.booster.infrastructure.adapter.llm;

import com.engagesphere.booster.infrastructure.config.LlmProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Blocking client for the text-generation service. Every failure surfaces as
 * a {@link TextGenerationException}; callers decide on the fallback.
 */
@Component
public class TextGenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(TextGenerationClient.class);

    private final TextGenerationApi textGenerationApi;
    private final LlmProperties properties;

    public TextGenerationClient(TextGenerationApi textGenerationApi, LlmProperties properties) {
        this.textGenerationApi = textGenerationApi;
        this.properties = properties;
    }

    @CircuitBreaker(name = "text-generation")
    @Retry(name = "text-generation")
    public String generate(String prompt, TextGenerationRequest.Parameters parameters) {
        if (!properties.isEnabled()) {
            throw new TextGenerationException("Text generation is disabled");
        }

        try {
            logger.debug("Requesting completion ({} max tokens)", parameters.maxNewTokens());
            var response = textGenerationApi.generate(new TextGenerationRequest(prompt, parameters)).execute();

            if (!response.isSuccessful()) {
                throw new TextGenerationException("Text generation failed with HTTP " + response.code());
            }
            if (response.body() == null || response.body().generatedText() == null) {
                throw new TextGenerationException("Text generation returned an empty body");
            }
            return response.body().generatedText().trim();

        } catch (IOException e) {
            throw new TextGenerationException("Text generation service unreachable", e);
        }
    }
}
