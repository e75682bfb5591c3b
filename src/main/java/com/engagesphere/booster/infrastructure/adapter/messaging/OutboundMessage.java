package com.engagesphere.booster.infrastructure.adapter.messaging;

/**
 * Composed content split into a subject line and a body.
 */
public record OutboundMessage(
        String subject,
        String body
) {
    static final String DEFAULT_SUBJECT = "A message from your event organizer";
    private static final String SUBJECT_PREFIX = "Subject:";

    /**
     * Parses {@code "Subject: ...\n\nbody"}. Content without that shape is used whole as the body.
     */
    public static OutboundMessage parse(String content) {
        String normalized = content == null ? "" : content.replace("\r\n", "\n");
        int separator = normalized.indexOf("\n\n");
        if (normalized.startsWith(SUBJECT_PREFIX) && separator > 0) {
            String subject = normalized.substring(SUBJECT_PREFIX.length(), separator).trim();
            String body = normalized.substring(separator + 2);
            return new OutboundMessage(subject.isEmpty() ? DEFAULT_SUBJECT : subject, body);
        }
        return new OutboundMessage(DEFAULT_SUBJECT, normalized);
    }
}
