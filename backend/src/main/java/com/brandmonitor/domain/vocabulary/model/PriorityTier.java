package com.brandmonitor.domain.vocabulary.model;

import com.brandmonitor.domain.classification.model.ReviewCategory;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The four keyword tiers, declared in precedence order (CRITICAL first).
 * A text matching none of them falls into the implicit priority 5.
 */
public enum PriorityTier {
    CRITICAL(1, ReviewCategory.CRITICAL, "CRITICAL"),
    STRATEGIC(2, ReviewCategory.STRATEGIC, "STRATEGIC"),
    OPERATIONAL(3, ReviewCategory.OPERATIONAL, "OPERATIONAL"),
    OPPORTUNITY(4, ReviewCategory.OPPORTUNITY, "OPPORTUNITIES");

    public static final int NO_MATCH_PRIORITY = 5;

    private final int priority;
    private final ReviewCategory category;
    private final String documentKey;

    PriorityTier(int priority, ReviewCategory category, String documentKey) {
        this.priority = priority;
        this.category = category;
        this.documentKey = documentKey;
    }

    public int priority() {
        return priority;
    }

    public ReviewCategory category() {
        return category;
    }

    /**
     * Key of this tier in the persisted vocabulary document.
     */
    public String documentKey() {
        return documentKey;
    }

    /**
     * Resolves a tier from user input. Case-insensitive; accepts both the enum name and the document key.
     */
    public static Optional<PriorityTier> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.name().equals(upper) || t.documentKey.equals(upper))
                .findFirst();
    }
}
