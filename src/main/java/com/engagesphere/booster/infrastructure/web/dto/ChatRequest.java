package com.engagesphere.booster.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;

public record ChatRequest(
        @NotBlank String query,
        String context
) {}
