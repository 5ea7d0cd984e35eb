package com.brandmonitor.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ReviewResponse(
        String title,
        String content,
        String source,
        String url,
        String sentiment,
        @JsonProperty("sentiment_score") double sentimentScore,
        @JsonProperty("sentiment_confidence") double sentimentConfidence,
        String category,
        int priority,
        List<String> keywords
) {}
