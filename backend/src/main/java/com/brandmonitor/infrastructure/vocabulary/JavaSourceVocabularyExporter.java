package com.brandmonitor.infrastructure.vocabulary;

import com.brandmonitor.domain.vocabulary.model.PriorityTier;
import com.brandmonitor.domain.vocabulary.model.Vocabulary;
import com.brandmonitor.domain.vocabulary.service.VocabularyExporter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Renders the vocabulary as a Java constants class, one ordered entry list per tier:
 * <pre>
 * public static final List&lt;Map.Entry&lt;String, Double&gt;&gt; CRITICAL_KEYWORDS = List.of(
 *         Map.entry("詐騙", 3.0));
 * </pre>
 */
@Component
public class JavaSourceVocabularyExporter implements VocabularyExporter {

    static final String CLASS_NAME = "KeywordConfig";

    private final String packageName;

    public JavaSourceVocabularyExporter(
            @Value("${vocabulary.export.package:com.brandmonitor.generated}") String packageName) {
        this.packageName = packageName;
    }

    @Override
    public String export(Vocabulary vocabulary) {
        StringBuilder sb = new StringBuilder();
        String lastUpdated = vocabulary.metadata().lastUpdated();
        String maintainer = vocabulary.metadata().maintainer();

        sb.append("/*\n");
        sb.append(" * Keyword configuration for 4-level priority classification.\n");
        sb.append(" *\n");
        sb.append(" * Last Updated: ").append(comment(lastUpdated != null ? lastUpdated : "Unknown")).append("\n");
        sb.append(" * Maintainer: ").append(comment(maintainer)).append("\n");
        sb.append(" * AUTO-GENERATED - edit through /api/keywords instead\n");
        sb.append(" */\n");
        if (packageName != null && !packageName.isBlank()) {
            sb.append("package ").append(packageName).append(";\n\n");
        }
        sb.append("import java.util.List;\n");
        sb.append("import java.util.Map;\n\n");
        sb.append("public final class ").append(CLASS_NAME).append(" {\n\n");

        for (PriorityTier tier : PriorityTier.values()) {
            appendTier(sb, tier, vocabulary.tier(tier).keywords());
        }

        sb.append("    private ").append(CLASS_NAME).append("() {\n");
        sb.append("    }\n");
        sb.append("}\n");
        return sb.toString();
    }

    private void appendTier(StringBuilder sb, PriorityTier tier, Map<String, Double> keywords) {
        sb.append("    public static final List<Map.Entry<String, Double>> ")
                .append(tier.documentKey()).append("_KEYWORDS = List.of(");

        Iterator<Map.Entry<String, Double>> it = keywords.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Double> entry = it.next();
            sb.append("\n            Map.entry(\"").append(escape(entry.getKey())).append("\", ")
                    .append(entry.getValue()).append(")");
            if (it.hasNext()) {
                sb.append(",");
            }
        }
        sb.append(");\n\n");
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (Character.isISOControl(c)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static String comment(String value) {
        return value == null ? "" : value.replace("*/", "* /").replaceAll("[\\r\\n]+", " ");
    }
}
