package com.brandmonitor.application.review;

import com.brandmonitor.application.vocabulary.VocabularyService;
import com.brandmonitor.domain.classification.model.ClassificationResult;
import com.brandmonitor.domain.classification.service.ReviewClassifier;
import com.brandmonitor.domain.review.model.AggregateReport;
import com.brandmonitor.domain.review.model.ReviewItem;
import com.brandmonitor.infrastructure.nlp.preprocessing.ReviewTextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Entry point for brand analysis: pasted text is split into one item per line, otherwise live
 * collection runs across all enabled collectors. Either way the items go through the aggregator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewAnalysisAppService {

    static final String USER_INPUT_SOURCE = "user_input";

    private final ReviewCollectionService collectionService;
    private final ReviewAggregator aggregator;
    private final ReviewClassifier classifier;
    private final VocabularyService vocabularyService;
    private final ReviewTextNormalizer normalizer;

    public AggregateReport analyze(String brandName, String rawText) {
        if (brandName == null || brandName.isBlank()) {
            throw new IllegalArgumentException("Brand name is required");
        }

        List<ReviewItem> items;
        if (rawText != null && !rawText.isBlank()) {
            items = splitUserInput(rawText);
            log.info("[ReviewAnalysis] Brand '{}': {} lines of user input", brandName, items.size());
        } else {
            items = collectionService.collect(brandName.strip());
            log.info("[ReviewAnalysis] Brand '{}': {} items from live collection", brandName, items.size());
        }

        return aggregator.aggregate(items);
    }

    public ClassificationResult classify(String text) {
        // Cleaned the same way as aggregated items
        return classifier.classify(normalizer.normalize(text), vocabularyService.snapshot());
    }

    List<ReviewItem> splitUserInput(String rawText) {
        return Arrays.stream(rawText.split("\\R"))
                .filter(line -> !line.isBlank())
                .map(line -> new ReviewItem(line, USER_INPUT_SOURCE, "", ""))
                .toList();
    }
}
