package com.brandmonitor.infrastructure.vocabulary;

import com.brandmonitor.domain.vocabulary.model.PriorityTier;
import com.brandmonitor.domain.vocabulary.model.TierKeywords;
import com.brandmonitor.domain.vocabulary.model.Vocabulary;
import com.brandmonitor.domain.vocabulary.model.VocabularyMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between {@link Vocabulary} and the persisted document shape:
 * <pre>
 * {
 *   "CRITICAL":      { "description": "...", "keywords": { "詐騙": 3.0 } },
 *   "STRATEGIC":     { ... },
 *   "OPERATIONAL":   { ... },
 *   "OPPORTUNITIES": { ... },
 *   "metadata":      { "lastUpdated": "2024-01-01 10:00:00", "maintainer": "..." }
 * }
 * </pre>
 * A missing tier reads as empty.
 */
@Component
public class VocabularyDocumentMapper {

    static final String METADATA = "metadata";
    static final String DESCRIPTION = "description";
    static final String KEYWORDS = "keywords";
    static final String LAST_UPDATED = "lastUpdated";
    static final String MAINTAINER = "maintainer";

    public Map<String, Object> toDocument(Vocabulary vocabulary) {
        Map<String, Object> document = new LinkedHashMap<>();
        for (PriorityTier tier : PriorityTier.values()) {
            document.put(tier.documentKey(), toTierDocument(vocabulary.tier(tier)));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(LAST_UPDATED, vocabulary.metadata().lastUpdated());
        metadata.put(MAINTAINER, vocabulary.metadata().maintainer());
        document.put(METADATA, metadata);
        return document;
    }

    public Map<String, Object> toTierDocument(TierKeywords keywords) {
        Map<String, Object> tierDocument = new LinkedHashMap<>();
        tierDocument.put(DESCRIPTION, keywords.description());
        tierDocument.put(KEYWORDS, new LinkedHashMap<>(keywords.keywords()));
        return tierDocument;
    }

    /**
     * @throws VocabularyStorageException when a weight is not numeric or the root is not an object
     */
    public Vocabulary fromDocument(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new VocabularyStorageException("Vocabulary document root must be a JSON object");
        }

        Map<PriorityTier, TierKeywords> tiers = new EnumMap<>(PriorityTier.class);
        for (PriorityTier tier : PriorityTier.values()) {
            JsonNode tierNode = root.get(tier.documentKey());
            if (tierNode != null && tierNode.isObject()) {
                tiers.put(tier, readTier(tier, tierNode));
            }
        }

        JsonNode metaNode = root.path(METADATA);
        VocabularyMetadata metadata = new VocabularyMetadata(
                metaNode.hasNonNull(LAST_UPDATED) ? metaNode.get(LAST_UPDATED).asText() : null,
                metaNode.hasNonNull(MAINTAINER) ? metaNode.get(MAINTAINER).asText() : "");

        return new Vocabulary(tiers, metadata);
    }

    private TierKeywords readTier(PriorityTier tier, JsonNode tierNode) {
        Map<String, Double> keywords = new LinkedHashMap<>();
        JsonNode keywordsNode = tierNode.path(KEYWORDS);
        Iterator<Map.Entry<String, JsonNode>> fields = keywordsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new VocabularyStorageException(String.format(
                        "Weight of \"%s\" in %s is not a number", field.getKey(), tier.documentKey()));
            }
            keywords.put(field.getKey(), field.getValue().asDouble());
        }
        return new TierKeywords(tierNode.path(DESCRIPTION).asText(""), keywords);
    }
}
