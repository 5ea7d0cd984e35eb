package com.brandmonitor.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ClassifyRequest(
        @NotNull(message = "text is required")
        @Size(max = 5000, message = "text must not exceed 5000 characters")
        String text
) {}
