package com.brandmonitor.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;

public record KeywordRequest(
        @NotBlank(message = "Category and word are required")
        String category,

        @NotBlank(message = "Category and word are required")
        String word,

        Double weight
) {
    public double weightOrDefault() {
        return weight != null ? weight : 1.0;
    }
}
