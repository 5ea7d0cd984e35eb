package com.brandmonitor.domain.classification.model;

import java.util.Locale;

public enum Sentiment {
    POSITIVE,
    NEGATIVE,
    NEUTRAL,
    SUGGESTION;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
