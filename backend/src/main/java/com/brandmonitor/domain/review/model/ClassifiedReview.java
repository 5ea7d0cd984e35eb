package com.brandmonitor.domain.review.model;

import com.brandmonitor.domain.classification.model.ClassificationResult;

public record ClassifiedReview(ReviewItem item, ClassificationResult classification) {

    public int priority() {
        return classification.priority();
    }
}
