package com.brandmonitor.domain.vocabulary.model;

/**
 * Document metadata. {@code lastUpdated} is kept verbatim as stored ({@code yyyy-MM-dd HH:mm:ss}).
 */
public record VocabularyMetadata(String lastUpdated, String maintainer) {

    public VocabularyMetadata withLastUpdated(String timestamp) {
        return new VocabularyMetadata(timestamp, maintainer);
    }
}
