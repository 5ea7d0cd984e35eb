package com.brandmonitor.infrastructure.vocabulary;

import com.brandmonitor.domain.vocabulary.model.Vocabulary;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Reads the bundled default vocabulary used when no document exists yet.
 */
@Slf4j
@Component
public class VocabularySeedLoader {

    private final ObjectMapper objectMapper;
    private final VocabularyDocumentMapper documentMapper;
    private final ResourceLoader resourceLoader;
    private final boolean enabled;
    private final String location;

    public VocabularySeedLoader(ObjectMapper objectMapper,
                                VocabularyDocumentMapper documentMapper,
                                ResourceLoader resourceLoader,
                                @Value("${vocabulary.seed-on-missing:true}") boolean enabled,
                                @Value("${vocabulary.seed-resource:classpath:vocabulary/default-keywords.json}") String location) {
        this.objectMapper = objectMapper;
        this.documentMapper = documentMapper;
        this.resourceLoader = resourceLoader;
        this.enabled = enabled;
        this.location = location;
    }

    public Optional<Vocabulary> loadSeed() {
        if (!enabled) {
            return Optional.empty();
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[VocabularySeed] Seed resource {} not found", location);
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            return Optional.of(documentMapper.fromDocument(objectMapper.readTree(in)));
        } catch (IOException e) {
            throw new VocabularyStorageException("Failed to read seed vocabulary " + location, e);
        }
    }
}
