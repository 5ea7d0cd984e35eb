package com.brandmonitor.domain.vocabulary.model;

import java.util.Map;

/**
 * @param perTierCount term count keyed by document key, in tier precedence order
 * @param total        sum over all tiers
 * @param lastUpdated  metadata timestamp, {@code "Unknown"} when the document never recorded one
 */
public record VocabularyStats(Map<String, Integer> perTierCount, int total, String lastUpdated) {}
