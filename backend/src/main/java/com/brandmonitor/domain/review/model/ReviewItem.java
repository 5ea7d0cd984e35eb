package com.brandmonitor.domain.review.model;

import java.time.LocalDateTime;

/**
 * One raw text item from a collector or from direct user input.
 * Only {@code text} is guaranteed; {@code url} (possibly empty) is the deduplication key.
 */
public record ReviewItem(
        String text,
        String sourceId,
        String url,
        String author,
        String title,
        LocalDateTime postedAt
) {
    public ReviewItem {
        text = text == null ? "" : text;
        sourceId = sourceId == null ? "" : sourceId;
        url = url == null ? "" : url;
        author = author == null ? "" : author;
    }

    public ReviewItem(String text, String sourceId, String url, String author) {
        this(text, sourceId, url, author, null, null);
    }

    public boolean hasUrl() {
        return !url.isBlank();
    }

    public ReviewItem withText(String newText) {
        return new ReviewItem(newText, sourceId, url, author, title, postedAt);
    }
}
