package com.brandmonitor.domain.vocabulary.repository;

import com.brandmonitor.domain.vocabulary.model.Vocabulary;

import java.util.Optional;

/**
 * Storage of the authoritative vocabulary document.
 */
public interface VocabularyRepository {

    /**
     * @return the stored vocabulary, or empty when no backing document exists
     */
    Optional<Vocabulary> load();

    /**
     * Replaces the whole stored document. Either the new document is fully written or the old one is kept.
     */
    void save(Vocabulary vocabulary);
}
