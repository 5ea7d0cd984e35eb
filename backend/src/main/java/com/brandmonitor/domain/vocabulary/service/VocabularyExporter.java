package com.brandmonitor.domain.vocabulary.service;

import com.brandmonitor.domain.vocabulary.model.Vocabulary;

/**
 * Renders a vocabulary as a derivative text artifact (e.g. a source file to embed elsewhere).
 * Implementations are pure formatters and do no I/O.
 */
public interface VocabularyExporter {

    String export(Vocabulary vocabulary);
}
