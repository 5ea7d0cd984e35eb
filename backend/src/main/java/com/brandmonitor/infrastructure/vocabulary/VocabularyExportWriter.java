package com.brandmonitor.infrastructure.vocabulary;

import com.brandmonitor.domain.vocabulary.model.Vocabulary;
import com.brandmonitor.domain.vocabulary.service.VocabularyExporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the exported vocabulary mirror to disk. A blank path disables the export.
 */
@Slf4j
@Component
public class VocabularyExportWriter {

    private final VocabularyExporter exporter;
    private final String target;

    public VocabularyExportWriter(VocabularyExporter exporter,
                                  @Value("${vocabulary.export.path:}") String target) {
        this.exporter = exporter;
        this.target = target;
    }

    public boolean isEnabled() {
        return target != null && !target.isBlank();
    }

    /**
     * @throws IOException when the file cannot be written; callers treat this as best-effort
     */
    public void write(Vocabulary vocabulary) throws IOException {
        if (!isEnabled()) {
            return;
        }
        Path path = Path.of(target);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, exporter.export(vocabulary), StandardCharsets.UTF_8);
        log.info("[VocabularyExport] Regenerated {} ({} terms)", path, vocabulary.totalTerms());
    }
}
