package com.brandmonitor.domain.review.model;

import com.brandmonitor.domain.classification.model.Sentiment;

import java.util.List;
import java.util.Map;

/**
 * Deduplicated, classified, priority-sorted view of one batch.
 *
 * @param items                  ascending by priority, input order among equal priorities
 * @param sentimentDistribution  count per sentiment, every sentiment present (zero when absent)
 * @param priorityDistribution   count per priority 1..5, every priority present
 */
public record AggregateReport(
        List<ClassifiedReview> items,
        Map<Sentiment, Integer> sentimentDistribution,
        Map<Integer, Integer> priorityDistribution
) {
    public int total() {
        return items.size();
    }
}
