package com.brandmonitor.domain.classification.model;

import java.util.Locale;

/**
 * Topical category of a classified text. Mirrors the resolved tier; {@link #NEUTRAL} when no tier matched.
 */
public enum ReviewCategory {
    CRITICAL,
    STRATEGIC,
    OPERATIONAL,
    OPPORTUNITY,
    NEUTRAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
