package com.brandmonitor.application.review;

import com.brandmonitor.application.vocabulary.VocabularyService;
import com.brandmonitor.domain.classification.model.Sentiment;
import com.brandmonitor.domain.classification.service.ReviewClassifier;
import com.brandmonitor.domain.review.model.AggregateReport;
import com.brandmonitor.domain.review.model.ClassifiedReview;
import com.brandmonitor.domain.review.model.ReviewItem;
import com.brandmonitor.domain.vocabulary.model.PriorityTier;
import com.brandmonitor.domain.vocabulary.model.Vocabulary;
import com.brandmonitor.infrastructure.nlp.preprocessing.ReviewTextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a batch of raw items into an {@link AggregateReport}:
 * normalize → drop short noise → dedup by url → classify → stable sort by priority → distributions.
 * <p>
 * The whole batch is classified against one vocabulary snapshot.
 * </p>
 */
@Slf4j
@Service
public class ReviewAggregator {

    private final VocabularyService vocabularyService;
    private final ReviewClassifier classifier;
    private final ReviewTextNormalizer normalizer;
    private final int minTextLength;

    public ReviewAggregator(VocabularyService vocabularyService,
                            ReviewClassifier classifier,
                            ReviewTextNormalizer normalizer,
                            @Value("${aggregator.min-text-length:5}") int minTextLength) {
        this.vocabularyService = vocabularyService;
        this.classifier = classifier;
        this.normalizer = normalizer;
        this.minTextLength = minTextLength;
    }

    /**
     * @throws com.brandmonitor.application.vocabulary.exception.VocabularyUnavailableException
     *         when the vocabulary store cannot be read; individual items never fail
     */
    public AggregateReport aggregate(List<ReviewItem> items) {
        Vocabulary vocabulary = vocabularyService.snapshot();

        List<ClassifiedReview> classified = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        int tooShort = 0;
        int duplicates = 0;

        for (ReviewItem raw : items == null ? List.<ReviewItem>of() : items) {
            if (raw == null) {
                continue;
            }
            ReviewItem item = raw.withText(normalizer.normalize(raw.text()));

            if (item.text().codePointCount(0, item.text().length()) < minTextLength) {
                tooShort++;
                continue;
            }
            if (item.hasUrl() && !seenUrls.add(item.url())) {
                duplicates++;
                continue;
            }
            classified.add(new ClassifiedReview(item, classifier.classify(item.text(), vocabulary)));
        }

        // Stream.sorted is stable for ordered streams: equal priorities keep input order
        List<ClassifiedReview> sorted = classified.stream()
                .sorted(Comparator.comparingInt(ClassifiedReview::priority))
                .toList();

        log.info("[ReviewAggregator] Aggregated {} items ({} too short, {} duplicate urls dropped)",
                sorted.size(), tooShort, duplicates);

        return new AggregateReport(sorted, sentimentDistribution(sorted), priorityDistribution(sorted));
    }

    private static Map<Sentiment, Integer> sentimentDistribution(List<ClassifiedReview> reviews) {
        Map<Sentiment, Integer> distribution = new EnumMap<>(Sentiment.class);
        for (Sentiment sentiment : Sentiment.values()) {
            distribution.put(sentiment, 0);
        }
        reviews.forEach(r -> distribution.merge(r.classification().sentiment(), 1, Integer::sum));
        return distribution;
    }

    private static Map<Integer, Integer> priorityDistribution(List<ClassifiedReview> reviews) {
        Map<Integer, Integer> distribution = new LinkedHashMap<>();
        for (int priority = 1; priority <= PriorityTier.NO_MATCH_PRIORITY; priority++) {
            distribution.put(priority, 0);
        }
        reviews.forEach(r -> distribution.merge(r.priority(), 1, Integer::sum));
        return distribution;
    }
}
