package com.engagesphere.booster.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Outbound channel settings. A channel with missing credentials logs
 * messages instead of sending them.
 */
@Component
@ConfigurationProperties(prefix = "engagesphere.messaging")
public class MessagingProperties {

    private String mailFrom;
    private final Twilio twilio = new Twilio();

    public String getMailFrom() {
        return mailFrom;
    }

    public void setMailFrom(String mailFrom) {
        this.mailFrom = mailFrom;
    }

    public Twilio getTwilio() {
        return twilio;
    }

    public static class Twilio {

        private String baseUrl = "https://api.twilio.com/";
        private String accountSid;
        private String authToken;
        private String whatsappFrom;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getAccountSid() {
            return accountSid;
        }

        public void setAccountSid(String accountSid) {
            this.accountSid = accountSid;
        }

        public String getAuthToken() {
            return authToken;
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }

        public String getWhatsappFrom() {
            return whatsappFrom;
        }

        public void setWhatsappFrom(String whatsappFrom) {
            this.whatsappFrom = whatsappFrom;
        }

        public boolean isConfigured() {
            return hasText(accountSid) && hasText(authToken) && hasText(whatsappFrom);
        }

        private static boolean hasText(String value) {
            return value != null && !value.isBlank();
        }
    }
}
