package com.engagesphere.booster.infrastructure.adapter.llm;

import retrofit2.Call;
import retrofit2.http.Body;
import retrofit2.http.POST;

/**
 * Text-generation inference endpoint (Hugging Face TGI compatible).
 */
public interface TextGenerationApi {

    /**
     * Generates a completion for the prompt in {@code inputs}.
     *
     * @return a {@code Call} whose body carries the generated text only, without the prompt
     */
    @POST("generate")
    Call<TextGenerationResponse> generate(@Body TextGenerationRequest request);
}
