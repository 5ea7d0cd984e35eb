package com.brandmonitor.domain.vocabulary.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable snapshot of the four keyword tiers.
 * <p>
 * Every mutation returns a new instance, so a reader holding a snapshot never observes a
 * half-applied change. Terms are unique within a tier; the same term may appear in several tiers.
 * </p>
 */
public record Vocabulary(Map<PriorityTier, TierKeywords> tiers, VocabularyMetadata metadata) {

    public Vocabulary {
        EnumMap<PriorityTier, TierKeywords> copy = new EnumMap<>(PriorityTier.class);
        for (PriorityTier tier : PriorityTier.values()) {
            TierKeywords keywords = tiers != null ? tiers.get(tier) : null;
            copy.put(tier, keywords != null ? keywords : TierKeywords.empty());
        }
        tiers = Collections.unmodifiableMap(copy);
        metadata = metadata != null ? metadata : new VocabularyMetadata(null, "");
    }

    public static Vocabulary empty() {
        return new Vocabulary(Map.of(), null);
    }

    public TierKeywords tier(PriorityTier tier) {
        return tiers.get(tier);
    }

    public boolean isEmpty() {
        return tiers.values().stream().allMatch(t -> t.size() == 0);
    }

    public int totalTerms() {
        return tiers.values().stream().mapToInt(TierKeywords::size).sum();
    }

    public Vocabulary withTier(PriorityTier tier, TierKeywords keywords) {
        EnumMap<PriorityTier, TierKeywords> copy = new EnumMap<>(tiers);
        copy.put(tier, keywords);
        return new Vocabulary(copy, metadata);
    }

    public Vocabulary withMetadata(VocabularyMetadata newMetadata) {
        return new Vocabulary(tiers, newMetadata);
    }
}
