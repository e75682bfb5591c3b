package com.engagesphere.booster.infrastructure.adapter.llm;

import com.engagesphere.booster.infrastructure.config.LlmProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmIntentExtractorTest {

    @Mock
    private TextGenerationClient textGenerationClient;

    private LlmProperties properties;
    private LlmIntentExtractor extractor;

    @BeforeEach
    void setUp() {
        properties = new LlmProperties();
        extractor = new LlmIntentExtractor(textGenerationClient, properties);
    }

    @Test
    void shouldReturnRawGeneratedText() {
        // Given
        when(textGenerationClient.generate(anyString(), any()))
                .thenReturn("{\"action\": \"register\", \"event_name\": \"AI Conference\"}");

        // When
        String raw = extractor.extract("sign me up for the AI Conference", "context");

        // Then
        assertThat(raw).isEqualTo("{\"action\": \"register\", \"event_name\": \"AI Conference\"}");
    }

    @Test
    void shouldUseGreedyDecoding() {
        // Given
        when(textGenerationClient.generate(anyString(), any())).thenReturn("{}");

        // When
        extractor.extract("hello", "context");

        // Then
        ArgumentCaptor<TextGenerationRequest.Parameters> parameters =
                ArgumentCaptor.forClass(TextGenerationRequest.Parameters.class);
        verify(textGenerationClient).generate(anyString(), parameters.capture());
        assertThat(parameters.getValue().doSample()).isFalse();
        assertThat(parameters.getValue().temperature()).isNull();
        assertThat(parameters.getValue().maxNewTokens()).isEqualTo(properties.getMaxIntentTokens());
    }

    @Test
    void shouldReturnConversationalApologyWhenServiceFails() {
        // Given
        when(textGenerationClient.generate(anyString(), any()))
                .thenThrow(new TextGenerationException("Text generation service unreachable"));

        // When
        String raw = extractor.extract("hello", "context");

        // Then
        assertThat(raw).isEqualTo(LlmIntentExtractor.UNAVAILABLE_RESPONSE);
    }

    @Test
    void shouldReturnUnavailableReplyWithoutCallingServiceWhenGenerationDisabled() {
        // Given
        properties.setEnabled(false);

        // When
        String raw = extractor.extract("hello", "context");

        // Then
        assertThat(raw).isEqualTo(LlmIntentExtractor.UNAVAILABLE_RESPONSE);
        verifyNoInteractions(textGenerationClient);
    }

    @Test
    void shouldTruncateLongContext() {
        // Given
        properties.setMaxContextChars(10);

        // When
        String truncated = extractor.truncate("0123456789abcdef");

        // Then
        assertThat(truncated).isEqualTo("0123456789\n... (context truncated)");
    }

    @Test
    void shouldKeepContextWithinLimit() {
        assertThat(extractor.truncate("short")).isEqualTo("short");
        assertThat(extractor.truncate(null)).isEmpty();
    }

    @Test
    void shouldPlaceContextAndQuestionInPrompt() {
        String prompt = extractor.buildPrompt("What am I registered for?", "EngageSphere context");

        assertThat(prompt)
                .contains("### Project Context\nEngageSphere context")
                .contains("### User Question\nWhat am I registered for?")
                .endsWith("<|assistant|>\n");
    }
}
