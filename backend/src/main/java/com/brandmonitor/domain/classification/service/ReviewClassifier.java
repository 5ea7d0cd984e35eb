package com.brandmonitor.domain.classification.service;

import com.brandmonitor.domain.classification.model.ClassificationResult;
import com.brandmonitor.domain.vocabulary.model.Vocabulary;

/**
 * Domain service that turns raw text into a prioritised signal.
 * <p>
 * Implementations must be deterministic and side-effect free: the vocabulary snapshot is passed in
 * explicitly and never read from shared state. Classification has no error path; degenerate input
 * yields the neutral, priority 5 result.
 * </p>
 */
public interface ReviewClassifier {

    ClassificationResult classify(String text, Vocabulary vocabulary);
}
