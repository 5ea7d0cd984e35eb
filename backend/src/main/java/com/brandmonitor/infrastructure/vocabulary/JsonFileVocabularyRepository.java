package com.brandmonitor.infrastructure.vocabulary;

import com.brandmonitor.domain.vocabulary.model.Vocabulary;
import com.brandmonitor.domain.vocabulary.repository.VocabularyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the vocabulary as one pretty-printed UTF-8 JSON file.
 * Writes go to a sibling temp file which is then moved over the target, so readers and crash
 * recovery only ever see a complete document.
 */
@Slf4j
@Repository
public class JsonFileVocabularyRepository implements VocabularyRepository {

    private final ObjectMapper objectMapper;
    private final VocabularyDocumentMapper documentMapper;
    private final Path path;

    public JsonFileVocabularyRepository(ObjectMapper objectMapper,
                                        VocabularyDocumentMapper documentMapper,
                                        @Value("${vocabulary.path:data/keywords.json}") Path path) {
        this.objectMapper = objectMapper;
        this.documentMapper = documentMapper;
        this.path = path;
    }

    @Override
    public Optional<Vocabulary> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
            return Optional.of(documentMapper.fromDocument(root));
        } catch (IOException e) {
            throw new VocabularyStorageException("Failed to read vocabulary document " + path, e);
        }
    }

    @Override
    public void save(Vocabulary vocabulary) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(documentMapper.toDocument(vocabulary));
        } catch (JsonProcessingException e) {
            throw new VocabularyStorageException("Failed to serialize vocabulary", e);
        }

        Path temp = null;
        try {
            Path dir = path.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            moveIntoPlace(temp);
            log.debug("[VocabularyRepository] Saved {} terms to {}", vocabulary.totalTerms(), path);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new VocabularyStorageException("Failed to write vocabulary document " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[VocabularyRepository] Atomic move not supported for {}, falling back to replace", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[VocabularyRepository] Could not remove temp file {}", temp, e);
        }
    }
}
