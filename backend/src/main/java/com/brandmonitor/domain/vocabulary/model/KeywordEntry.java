package com.brandmonitor.domain.vocabulary.model;

public record KeywordEntry(PriorityTier tier, String term, double weight) {}
