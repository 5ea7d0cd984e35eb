package com.brandmonitor.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record AnalyzeResponse(
        @JsonProperty("brand_name") String brandName,
        @JsonProperty("total_reviews") int totalReviews,
        List<ReviewResponse> reviews,
        @JsonProperty("sentiment_distribution") Map<String, Integer> sentimentDistribution,
        @JsonProperty("priority_distribution") Map<Integer, Integer> priorityDistribution
) {}
