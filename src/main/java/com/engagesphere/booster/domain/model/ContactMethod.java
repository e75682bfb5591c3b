package com.engagesphere.booster.domain.model;

import java.util.Locale;

/**
 * Delivery route for outbound messages. Anything that is not a known
 * route is delivered by email.
 */
public enum ContactMethod {
    EMAIL("email"),
    WHATSAPP("whatsapp");

    private final String value;

    ContactMethod(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ContactMethod fromValue(String value) {
        if (value != null && WHATSAPP.value.equals(value.trim().toLowerCase(Locale.ROOT))) {
            return WHATSAPP;
        }
        return EMAIL;
    }
}
