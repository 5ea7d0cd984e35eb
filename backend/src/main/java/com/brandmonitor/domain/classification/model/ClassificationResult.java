package com.brandmonitor.domain.classification.model;

import java.util.List;

/**
 * Outcome of classifying one text.
 *
 * @param sourceText      the text as given to the classifier
 * @param sentiment       derived from the resolved tier, never independently scored
 * @param score           sentiment score in [0, 1]
 * @param confidence      in [0, 0.95]
 * @param category        resolved category
 * @param priority        1 (act now) to 5 (no action)
 * @param matchedKeywords tier-prefixed matches ({@code "STRATEGIC:態度"}), earliest first, at most 8
 */
public record ClassificationResult(
        String sourceText,
        Sentiment sentiment,
        double score,
        double confidence,
        ReviewCategory category,
        int priority,
        List<String> matchedKeywords
) {
    public ClassificationResult {
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }
}
