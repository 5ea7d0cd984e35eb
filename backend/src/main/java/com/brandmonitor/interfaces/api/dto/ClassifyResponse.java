package com.brandmonitor.interfaces.api.dto;

import com.brandmonitor.domain.classification.model.ClassificationResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ClassifyResponse(
        String text,
        String sentiment,
        @JsonProperty("sentiment_score") double sentimentScore,
        @JsonProperty("sentiment_confidence") double sentimentConfidence,
        String category,
        int priority,
        List<String> keywords
) {
    public static ClassifyResponse from(ClassificationResult result) {
        return new ClassifyResponse(
                result.sourceText(),
                result.sentiment().label(),
                result.score(),
                result.confidence(),
                result.category().label(),
                result.priority(),
                result.matchedKeywords());
    }
}
