package com.engagesphere.booster.infrastructure.adapter.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TextGenerationResponse(
        @JsonProperty("generated_text") String generatedText
) {}
