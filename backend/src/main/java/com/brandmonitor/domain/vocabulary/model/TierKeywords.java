package com.brandmonitor.domain.vocabulary.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable keyword set of one tier: insertion-ordered {@code term -> weight} plus a human description.
 */
public record TierKeywords(String description, Map<String, Double> keywords) {

    public TierKeywords {
        description = description == null ? "" : description;
        keywords = keywords == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public static TierKeywords empty() {
        return new TierKeywords("", Map.of());
    }

    public boolean contains(String term) {
        return keywords.containsKey(term);
    }

    public int size() {
        return keywords.size();
    }

    /**
     * Returns a copy with {@code term} set to {@code weight}. An existing term keeps its position.
     */
    public TierKeywords with(String term, double weight) {
        Map<String, Double> copy = new LinkedHashMap<>(keywords);
        copy.put(term, weight);
        return new TierKeywords(description, copy);
    }

    public TierKeywords without(String term) {
        Map<String, Double> copy = new LinkedHashMap<>(keywords);
        copy.remove(term);
        return new TierKeywords(description, copy);
    }
}
