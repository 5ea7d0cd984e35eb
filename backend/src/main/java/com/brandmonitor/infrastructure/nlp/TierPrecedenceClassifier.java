package com.brandmonitor.infrastructure.nlp;

import com.brandmonitor.domain.classification.model.ClassificationResult;
import com.brandmonitor.domain.classification.model.ReviewCategory;
import com.brandmonitor.domain.classification.model.Sentiment;
import com.brandmonitor.domain.classification.service.ReviewClassifier;
import com.brandmonitor.domain.vocabulary.model.PriorityTier;
import com.brandmonitor.domain.vocabulary.model.Vocabulary;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keyword-driven priority classifier.
 * <p>
 * Every tier is scanned (sum of weights of contained keywords), then the first tier in precedence order
 * CRITICAL &gt; STRATEGIC &gt; OPERATIONAL &gt; OPPORTUNITY with a positive score decides priority, category
 * and sentiment. Lower tiers still contribute to {@code matchedKeywords} but never to the decision.
 * Sentiment is read off the resolved tier, so a negative result always carries priority 1 or 2.
 * </p>
 */
@Component
public class TierPrecedenceClassifier implements ReviewClassifier {

    public static final List<String> DEFAULT_SERVICE_MARKERS = List.of(
            "客服", "服務", "售後", "回應", "處理", "態度", "回覆", "店員", "員工"
    );

    static final int MIN_TEXT_LENGTH = 2;
    static final int MAX_MATCHED_KEYWORDS = 8;
    static final double MAX_CONFIDENCE = 0.95;

    private static final Outcome DEGENERATE = new Outcome(Sentiment.NEUTRAL, 0.5, 0.0);
    private static final Outcome NO_MATCH = new Outcome(Sentiment.NEUTRAL, 0.50, 0.30);
    private static final Outcome CRITICAL = new Outcome(Sentiment.NEGATIVE, 0.15, 0.95);
    private static final Outcome STRATEGIC_SERVICE = new Outcome(Sentiment.NEGATIVE, 0.35, 0.80);
    private static final Outcome STRATEGIC = new Outcome(Sentiment.NEUTRAL, 0.50, 0.80);
    private static final Outcome OPERATIONAL = new Outcome(Sentiment.NEUTRAL, 0.50, 0.70);
    private static final Outcome OPPORTUNITY = new Outcome(Sentiment.POSITIVE, 0.85, 0.85);

    private final List<String> serviceMarkers;

    public TierPrecedenceClassifier(
            @Value("${classifier.service-markers:客服,服務,售後,回應,處理,態度,回覆,店員,員工}")
            List<String> serviceMarkers) {
        this.serviceMarkers = serviceMarkers == null || serviceMarkers.isEmpty()
                ? DEFAULT_SERVICE_MARKERS
                : List.copyOf(serviceMarkers);
    }

    @Override
    public ClassificationResult classify(String text, Vocabulary vocabulary) {
        String sourceText = text == null ? "" : text;
        String trimmed = sourceText.strip();

        // Degenerate input never reaches tier lookup
        if (trimmed.codePointCount(0, trimmed.length()) < MIN_TEXT_LENGTH) {
            return result(sourceText, DEGENERATE, ReviewCategory.NEUTRAL, PriorityTier.NO_MATCH_PRIORITY, List.of());
        }

        Vocabulary snapshot = vocabulary != null ? vocabulary : Vocabulary.empty();
        String folded = KeywordMatcher.fold(trimmed);

        List<String> matched = new ArrayList<>();
        PriorityTier resolved = null;

        for (PriorityTier tier : PriorityTier.values()) {
            double tierScore = 0;
            for (Map.Entry<String, Double> keyword : snapshot.tier(tier).keywords().entrySet()) {
                if (!KeywordMatcher.contains(folded, keyword.getKey())) {
                    continue;
                }
                tierScore += keyword.getValue() != null ? keyword.getValue() : 0;
                if (matched.size() < MAX_MATCHED_KEYWORDS) {
                    matched.add(tier.name() + ":" + keyword.getKey());
                }
            }
            if (resolved == null && tierScore > 0) {
                resolved = tier;
            }
        }

        if (resolved == null) {
            return result(sourceText, NO_MATCH, ReviewCategory.NEUTRAL, PriorityTier.NO_MATCH_PRIORITY, matched);
        }
        return result(sourceText, outcomeFor(resolved, folded), resolved.category(), resolved.priority(), matched);
    }

    public List<String> getServiceMarkers() {
        return serviceMarkers;
    }

    private Outcome outcomeFor(PriorityTier tier, String foldedText) {
        return switch (tier) {
            case CRITICAL -> CRITICAL;
            case STRATEGIC -> KeywordMatcher.containsAny(foldedText, serviceMarkers) ? STRATEGIC_SERVICE : STRATEGIC;
            case OPERATIONAL -> OPERATIONAL;
            case OPPORTUNITY -> OPPORTUNITY;
        };
    }

    private static ClassificationResult result(String sourceText, Outcome outcome, ReviewCategory category,
                                               int priority, List<String> matched) {
        return new ClassificationResult(
                sourceText,
                outcome.sentiment(),
                outcome.score(),
                Math.min(outcome.confidence(), MAX_CONFIDENCE),
                category,
                priority,
                matched);
    }

    private record Outcome(Sentiment sentiment, double score, double confidence) {}
}
