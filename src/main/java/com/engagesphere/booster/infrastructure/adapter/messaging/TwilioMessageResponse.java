package com.engagesphere.booster.infrastructure.adapter.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TwilioMessageResponse(
        String sid,
        String status
) {}
