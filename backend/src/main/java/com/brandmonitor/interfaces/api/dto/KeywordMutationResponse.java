package com.brandmonitor.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeywordMutationResponse(
        String message,
        String category,
        String word,
        Double weight
) {}
