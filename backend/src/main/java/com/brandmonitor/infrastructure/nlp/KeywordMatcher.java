package com.brandmonitor.infrastructure.nlp;

import java.util.Locale;

/**
 * Raw substring containment, no tokenization or stemming: a keyword may match inside a longer word.
 * Latin text is compared case-insensitively; CJK has no case, so folding leaves it exact.
 */
public final class KeywordMatcher {

    private KeywordMatcher() {
    }

    /**
     * Case-folds text once so it can be probed with many keywords.
     */
    public static String fold(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /**
     * @param foldedText text already passed through {@link #fold(String)}
     * @param keyword    raw keyword; blank keywords never match
     */
    public static boolean contains(String foldedText, String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return false;
        }
        return foldedText.contains(fold(keyword));
    }

    public static boolean containsAny(String foldedText, Iterable<String> keywords) {
        for (String keyword : keywords) {
            if (contains(foldedText, keyword)) {
                return true;
            }
        }
        return false;
    }
}
