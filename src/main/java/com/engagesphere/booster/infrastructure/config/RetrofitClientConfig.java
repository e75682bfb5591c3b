package com.engagesphere.booster.infrastructure.config;

import com.engagesphere.booster.infrastructure.adapter.llm.TextGenerationApi;
import com.engagesphere.booster.infrastructure.adapter.messaging.TwilioMessagesApi;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

@Configuration
public class RetrofitClientConfig {

    @Bean
    public TextGenerationApi textGenerationApi(LlmProperties properties) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(properties.getTimeout())
                .readTimeout(properties.getTimeout())
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(properties.getBaseUrl())
                .client(httpClient)
                .addConverterFactory(JacksonConverterFactory.create(jsonMapper()))
                .build();

        return retrofit.create(TextGenerationApi.class);
    }

    @Bean
    public TwilioMessagesApi twilioMessagesApi(MessagingProperties properties) {
        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(properties.getTwilio().getBaseUrl())
                .addConverterFactory(JacksonConverterFactory.create(jsonMapper()))
                .build();

        return retrofit.create(TwilioMessagesApi.class);
    }

    private static ObjectMapper jsonMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
