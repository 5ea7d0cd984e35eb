package com.brandmonitor.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnalyzeRequest(
        @JsonProperty("brand_name")
        @NotBlank(message = "brand_name is required")
        @Size(max = 100, message = "brand_name must not exceed 100 characters")
        String brandName,

        @Size(max = 50000, message = "text must not exceed 50000 characters")
        String text
) {}
