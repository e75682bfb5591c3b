package com.engagesphere.booster.domain.scheduling;

import com.engagesphere.booster.domain.model.MessageType;
import java.time.Duration;

/**
 * The five communications tied to an event's timeline, with their offset
 * from the event start.
 */
public enum JobKind {
    PREVIEW("preview", Duration.ofHours(-72), MessageType.CONTENT_PREVIEW, true),
    REMINDER_24H("reminder_24h", Duration.ofHours(-24), MessageType.REMINDER_24H, true),
    REMINDER_1H("reminder_1h", Duration.ofHours(-1), MessageType.REMINDER_1H, true),
    START("start", Duration.ZERO, MessageType.EVENT_STARTING, true),
    // Conditioned on the event having happened, not on registration lead time
    FOLLOW_UP("follow_up", Duration.ofHours(2), MessageType.FOLLOW_UP, false);

    private final String value;
    private final Duration offset;
    private final MessageType messageType;
    private final boolean skipWhenPastDue;

    JobKind(String value, Duration offset, MessageType messageType, boolean skipWhenPastDue) {
        this.value = value;
        this.offset = offset;
        this.messageType = messageType;
        this.skipWhenPastDue = skipWhenPastDue;
    }

    public String value() {
        return value;
    }

    public Duration offset() {
        return offset;
    }

    public MessageType messageType() {
        return messageType;
    }

    public boolean skipWhenPastDue() {
        return skipWhenPastDue;
    }
}
