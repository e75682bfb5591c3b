package com.engagesphere.booster.infrastructure.adapter.messaging;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OutboundMessageTest {

    @Test
    void shouldSplitSubjectFromBody() {
        OutboundMessage message = OutboundMessage.parse("Subject: See you tomorrow\n\nHi Ada,\n\nIt starts at 10.");

        assertThat(message.subject()).isEqualTo("See you tomorrow");
        assertThat(message.body()).isEqualTo("Hi Ada,\n\nIt starts at 10.");
    }

    @Test
    void shouldNormaliseWindowsLineEndings() {
        OutboundMessage message = OutboundMessage.parse("Subject: Hello\r\n\r\nBody");

        assertThat(message.subject()).isEqualTo("Hello");
        assertThat(message.body()).isEqualTo("Body");
    }

    @Test
    void shouldUseDefaultSubjectWhenContentHasNone() {
        OutboundMessage message = OutboundMessage.parse("Just a body");

        assertThat(message.subject()).isEqualTo(OutboundMessage.DEFAULT_SUBJECT);
        assertThat(message.body()).isEqualTo("Just a body");
    }

    @Test
    void shouldUseDefaultSubjectWhenSubjectLineIsEmpty() {
        OutboundMessage message = OutboundMessage.parse("Subject:\n\nBody");

        assertThat(message.subject()).isEqualTo(OutboundMessage.DEFAULT_SUBJECT);
        assertThat(message.body()).isEqualTo("Body");
    }

    @Test
    void shouldTreatNullAsEmptyBody() {
        assertThat(OutboundMessage.parse(null).body()).isEmpty();
    }
}
