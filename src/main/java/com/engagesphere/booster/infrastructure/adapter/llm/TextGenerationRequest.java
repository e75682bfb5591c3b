package com.engagesphere.booster.infrastructure.adapter.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public record TextGenerationRequest(
        String inputs,
        Parameters parameters
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Parameters(
            @JsonProperty("max_new_tokens") int maxNewTokens,
            @JsonProperty("do_sample") boolean doSample,
            Double temperature,
            @JsonProperty("top_k") Integer topK,
            @JsonProperty("top_p") Double topP,
            @JsonProperty("return_full_text") boolean returnFullText
    ) {
        public static Parameters sampled(int maxNewTokens, double temperature) {
            return new Parameters(maxNewTokens, true, temperature, 50, 0.95, false);
        }

        public static Parameters greedy(int maxNewTokens) {
            return new Parameters(maxNewTokens, false, null, null, null, false);
        }
    }
}
