package com.brandmonitor.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record MoveKeywordRequest(
        @JsonProperty("from_category")
        @NotBlank(message = "from_category, to_category, and word are required")
        String fromCategory,

        @JsonProperty("to_category")
        @NotBlank(message = "from_category, to_category, and word are required")
        String toCategory,

        @NotBlank(message = "from_category, to_category, and word are required")
        String word,

        Double weight
) {
    public double weightOrDefault() {
        return weight != null ? weight : 1.0;
    }
}
