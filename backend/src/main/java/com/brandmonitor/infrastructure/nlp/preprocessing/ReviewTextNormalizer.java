package com.brandmonitor.infrastructure.nlp.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans scraped or pasted review text before classification:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Every whitespace run (newlines included) collapsed to one space, then trimmed
 */
@Component
public class ReviewTextNormalizer {

    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    // Includes the ideographic space (U+3000) and NBSP common in CJK pages
    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\u00A0\\u3000]+");

    private static final String ELLIPSIS = "...";

    /**
     * @return the cleaned text; {@code ""} for null input
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ");

        return result.strip();
    }

    /**
     * Cuts text to at most {@code maxLength} code points without splitting a surrogate pair.
     */
    public String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (maxLength <= 0) {
            return "";
        }
        if (text.codePointCount(0, text.length()) <= maxLength) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxLength));
    }

    /**
     * Short display title: the text itself when short enough, otherwise its head plus an ellipsis.
     */
    public String titleOf(String text, int maxLength) {
        String normalized = normalize(text);
        String head = truncate(normalized, maxLength);
        return head.length() < normalized.length() ? head + ELLIPSIS : head;
    }
}
