package com.brandmonitor.application.review;

import com.brandmonitor.domain.review.model.ReviewItem;

import java.util.List;

/**
 * Result of one collector call: either items or an error, never both.
 */
public record CollectorOutcome(String sourceId, List<ReviewItem> items, String error, long durationMs) {

    public CollectorOutcome {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static CollectorOutcome success(String sourceId, List<ReviewItem> items, long durationMs) {
        return new CollectorOutcome(sourceId, items, null, durationMs);
    }

    public static CollectorOutcome failure(String sourceId, String error, long durationMs) {
        return new CollectorOutcome(sourceId, List.of(), error, durationMs);
    }

    public boolean succeeded() {
        return error == null;
    }
}
