package com.engagesphere.booster.domain.model;

public enum MessageType {
    WELCOME("welcome"),
    CONTENT_PREVIEW("content_preview"),
    REMINDER_24H("reminder_24h"),
    REMINDER_1H("reminder_1h"),
    EVENT_STARTING("event_starting"),
    FOLLOW_UP("follow_up");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
