package com.brandmonitor.application.vocabulary;

import com.brandmonitor.application.vocabulary.exception.DuplicateKeywordException;
import com.brandmonitor.application.vocabulary.exception.InvalidKeywordException;
import com.brandmonitor.application.vocabulary.exception.KeywordNotFoundException;
import com.brandmonitor.application.vocabulary.exception.TierNotFoundException;
import com.brandmonitor.application.vocabulary.exception.VocabularyUnavailableException;
import com.brandmonitor.domain.vocabulary.model.KeywordEntry;
import com.brandmonitor.domain.vocabulary.model.PriorityTier;
import com.brandmonitor.domain.vocabulary.model.TierKeywords;
import com.brandmonitor.domain.vocabulary.model.Vocabulary;
import com.brandmonitor.domain.vocabulary.model.VocabularyMetadata;
import com.brandmonitor.domain.vocabulary.model.VocabularyStats;
import com.brandmonitor.domain.vocabulary.repository.VocabularyRepository;
import com.brandmonitor.infrastructure.vocabulary.VocabularyExportWriter;
import com.brandmonitor.infrastructure.vocabulary.VocabularySeedLoader;
import com.brandmonitor.infrastructure.vocabulary.VocabularyStorageException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Owner of the live vocabulary.
 * <p>
 * Readers get an immutable snapshot without locking. Writers are serialized; each mutation builds a new
 * snapshot, persists the full document, and only then publishes it. A failed save leaves both the document
 * and the published snapshot untouched. The source-code export runs afterwards and never fails a request.
 * </p>
 */
@Slf4j
@Service
public class VocabularyService {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final String UNKNOWN_TIMESTAMP = "Unknown";

    private final VocabularyRepository repository;
    private final VocabularySeedLoader seedLoader;
    private final VocabularyExportWriter exportWriter;
    private final Clock clock;
    private final String defaultMaintainer;

    private final Object writeLock = new Object();
    private volatile Vocabulary current;

    public VocabularyService(VocabularyRepository repository,
                             VocabularySeedLoader seedLoader,
                             VocabularyExportWriter exportWriter,
                             Clock clock,
                             @Value("${vocabulary.default-maintainer:brand-monitor}") String defaultMaintainer) {
        this.repository = repository;
        this.seedLoader = seedLoader;
        this.exportWriter = exportWriter;
        this.clock = clock;
        this.defaultMaintainer = defaultMaintainer;
    }

    @PostConstruct
    void loadOnStartup() {
        try {
            reload();
        } catch (VocabularyUnavailableException e) {
            // Keep the app up; classification requests report 503 until the document is fixed
            log.error("[VocabularyService] Vocabulary could not be loaded at startup", e);
        }
    }

    /**
     * Re-reads the backing document. A missing document is seeded from the bundled default when enabled,
     * otherwise treated as an empty vocabulary.
     *
     * @throws VocabularyUnavailableException when the document exists but cannot be read
     */
    public Vocabulary reload() {
        synchronized (writeLock) {
            Vocabulary loaded;
            try {
                loaded = repository.load().orElseGet(this::seedOrEmpty);
            } catch (VocabularyStorageException e) {
                current = null;
                throw new VocabularyUnavailableException("Vocabulary store is unreadable", e);
            }
            current = loaded;
            log.info("[VocabularyService] Vocabulary loaded: {} terms, lastUpdated={}",
                    loaded.totalTerms(), loaded.metadata().lastUpdated());
            return loaded;
        }
    }

    /**
     * Current immutable snapshot. Callers classifying a batch should take one snapshot and reuse it.
     *
     * @throws VocabularyUnavailableException when the store could not be read
     */
    public Vocabulary snapshot() {
        Vocabulary snapshot = current;
        return snapshot != null ? snapshot : reload();
    }

    public TierKeywords getTier(String tierName) {
        PriorityTier tier = PriorityTier.fromName(tierName)
                .orElseThrow(() -> new TierNotFoundException(upper(tierName)));
        return snapshot().tier(tier);
    }

    /**
     * Substring search over all tiers. Tiers without a hit are omitted.
     */
    public Map<PriorityTier, TierKeywords> search(String query) {
        if (query == null || query.isEmpty()) {
            throw new InvalidKeywordException("Search query must not be empty");
        }
        Vocabulary snapshot = snapshot();
        Map<PriorityTier, TierKeywords> results = new LinkedHashMap<>();
        for (PriorityTier tier : PriorityTier.values()) {
            TierKeywords keywords = snapshot.tier(tier);
            Map<String, Double> matches = new LinkedHashMap<>();
            keywords.keywords().forEach((term, weight) -> {
                if (term.contains(query)) {
                    matches.put(term, weight);
                }
            });
            if (!matches.isEmpty()) {
                results.put(tier, new TierKeywords(keywords.description(), matches));
            }
        }
        return results;
    }

    public VocabularyStats stats() {
        Vocabulary snapshot = snapshot();
        Map<String, Integer> perTier = new LinkedHashMap<>();
        for (PriorityTier tier : PriorityTier.values()) {
            perTier.put(tier.documentKey(), snapshot.tier(tier).size());
        }
        String lastUpdated = snapshot.metadata().lastUpdated();
        return new VocabularyStats(perTier, snapshot.totalTerms(),
                lastUpdated != null ? lastUpdated : UNKNOWN_TIMESTAMP);
    }

    public KeywordEntry addTerm(String tierName, String term, double weight) {
        PriorityTier tier = requireTier(tierName);
        String word = requireTerm(term);
        requireWeight(weight);

        synchronized (writeLock) {
            Vocabulary base = snapshot();
            TierKeywords keywords = base.tier(tier);
            if (keywords.contains(word)) {
                throw new DuplicateKeywordException(word, tier.documentKey());
            }
            commit(base.withTier(tier, keywords.with(word, weight)));
        }
        log.info("[VocabularyService] Added \"{}\" to {} (weight {})", word, tier.documentKey(), weight);
        return new KeywordEntry(tier, word, weight);
    }

    public KeywordEntry updateTerm(String tierName, String term, double weight) {
        PriorityTier tier = requireExistingTier(tierName);
        String word = requireTerm(term);
        requireWeight(weight);

        synchronized (writeLock) {
            Vocabulary base = snapshot();
            TierKeywords keywords = base.tier(tier);
            if (!keywords.contains(word)) {
                throw new KeywordNotFoundException(word, tier.documentKey());
            }
            commit(base.withTier(tier, keywords.with(word, weight)));
        }
        log.info("[VocabularyService] Updated \"{}\" in {} (weight {})", word, tier.documentKey(), weight);
        return new KeywordEntry(tier, word, weight);
    }

    public void deleteTerm(String tierName, String term) {
        PriorityTier tier = requireExistingTier(tierName);
        String word = requireTerm(term);

        synchronized (writeLock) {
            Vocabulary base = snapshot();
            TierKeywords keywords = base.tier(tier);
            if (!keywords.contains(word)) {
                throw new KeywordNotFoundException(word, tier.documentKey());
            }
            commit(base.withTier(tier, keywords.without(word)));
        }
        log.info("[VocabularyService] Deleted \"{}\" from {}", word, tier.documentKey());
    }

    /**
     * Moves a term between tiers as one document write: the term ends up in exactly one of the two tiers.
     * If {@code toTier} already holds the term its weight is overwritten.
     */
    public KeywordEntry moveTerm(String fromTierName, String toTierName, String term, double weight) {
        PriorityTier from = requireExistingTier(fromTierName);
        PriorityTier to = requireTier(toTierName);
        String word = requireTerm(term);
        requireWeight(weight);

        synchronized (writeLock) {
            Vocabulary base = snapshot();
            if (!base.tier(from).contains(word)) {
                throw new KeywordNotFoundException(word, from.documentKey());
            }
            Vocabulary moved = base.withTier(from, base.tier(from).without(word));
            moved = moved.withTier(to, moved.tier(to).with(word, weight));
            commit(moved);
        }
        log.info("[VocabularyService] Moved \"{}\" from {} to {} (weight {})",
                word, from.documentKey(), to.documentKey(), weight);
        return new KeywordEntry(to, word, weight);
    }

    // ===== Internal methods =====

    private void commit(Vocabulary next) {
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
        Vocabulary stamped = next.withMetadata(withMaintainer(next.metadata()).withLastUpdated(timestamp));

        // Persist first; the published snapshot only changes once the document is on disk
        repository.save(stamped);
        current = stamped;

        try {
            exportWriter.write(stamped);
        } catch (IOException | RuntimeException e) {
            log.warn("[VocabularyService] Source export failed, JSON document remains authoritative", e);
        }
    }

    private Vocabulary seedOrEmpty() {
        Optional<Vocabulary> seed = seedLoader.loadSeed();
        if (seed.isEmpty()) {
            log.warn("[VocabularyService] No vocabulary document found, running with empty tiers");
            return Vocabulary.empty().withMetadata(new VocabularyMetadata(null, defaultMaintainer));
        }
        Vocabulary seeded = seed.get().withMetadata(withMaintainer(seed.get().metadata())
                .withLastUpdated(LocalDateTime.now(clock).format(TIMESTAMP_FORMAT)));
        try {
            repository.save(seeded);
            log.info("[VocabularyService] Seeded vocabulary document with {} terms", seeded.totalTerms());
        } catch (VocabularyStorageException e) {
            log.warn("[VocabularyService] Seed could not be persisted, serving it from memory", e);
        }
        return seeded;
    }

    private VocabularyMetadata withMaintainer(VocabularyMetadata metadata) {
        if (metadata.maintainer() == null || metadata.maintainer().isBlank()) {
            return new VocabularyMetadata(metadata.lastUpdated(), defaultMaintainer);
        }
        return metadata;
    }

    private static PriorityTier requireTier(String tierName) {
        if (tierName == null || tierName.isBlank()) {
            throw new InvalidKeywordException("Category is required");
        }
        return PriorityTier.fromName(tierName)
                .orElseThrow(() -> new InvalidKeywordException("Unknown category: " + upper(tierName)));
    }

    // Unknown tiers here are lookup misses (404); an unknown add or move target is invalid input (400)
    private static PriorityTier requireExistingTier(String tierName) {
        if (tierName == null || tierName.isBlank()) {
            throw new InvalidKeywordException("Category is required");
        }
        return PriorityTier.fromName(tierName)
                .orElseThrow(() -> new TierNotFoundException(upper(tierName)));
    }

    private static String requireTerm(String term) {
        String word = term == null ? "" : term.strip();
        if (word.isEmpty()) {
            throw new InvalidKeywordException("Keyword is required");
        }
        return word;
    }

    private static void requireWeight(double weight) {
        if (!(weight > 0) || Double.isInfinite(weight)) {
            throw new InvalidKeywordException("Weight must be a positive number");
        }
    }

    private static String upper(String value) {
        return value == null ? "" : value.strip().toUpperCase(Locale.ROOT);
    }
}
