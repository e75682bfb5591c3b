package com.engagesphere.booster.infrastructure.web.dto;

public record ChatResponse(
        String reply
) {}
