package com.engagesphere.booster.infrastructure.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection and sampling settings for the text-generation service
 */
@Component
@ConfigurationProperties(prefix = "engagesphere.llm")
public class LlmProperties {

    private boolean enabled = true;
    private String baseUrl = "http://localhost:8081/";
    private Duration timeout = Duration.ofSeconds(30);
    private int maxNewTokens = 250;
    private int maxIntentTokens = 150;
    private double temperature = 0.7;
    private int maxContextChars = 3000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxNewTokens() {
        return maxNewTokens;
    }

    public void setMaxNewTokens(int maxNewTokens) {
        this.maxNewTokens = maxNewTokens;
    }

    public int getMaxIntentTokens() {
        return maxIntentTokens;
    }

    public void setMaxIntentTokens(int maxIntentTokens) {
        this.maxIntentTokens = maxIntentTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxContextChars() {
        return maxContextChars;
    }

    public void setMaxContextChars(int maxContextChars) {
        this.maxContextChars = maxContextChars;
    }
}
