package com.brandmonitor.infrastructure.collector;

import com.brandmonitor.domain.review.model.ReviewItem;
import com.brandmonitor.domain.review.service.SourceCollector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Google search results through the SerpAPI JSON endpoint.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "collector.serpapi.enabled", havingValue = "true")
public class SerpApiCollector implements SourceCollector {

    static final List<String> QUERY_SUFFIXES = List.of("評論", "缺點", "品質", "不好", "review");
    static final String MISSING_SNIPPET = "(無摘要)";
    static final String AUTHOR = "Google Search";
    static final int SNIPPET_MAX_LENGTH = 500;
    static final int RESULTS_PER_QUERY = 20;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    public SerpApiCollector(RestClient collectorRestClient,
                            ObjectMapper objectMapper,
                            @Value("${collector.serpapi.base-url:https://serpapi.com/search}") String baseUrl,
                            @Value("${collector.serpapi.api-key:}") String apiKey) {
        this.restClient = collectorRestClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public String sourceId() {
        return "serpapi";
    }

    @Override
    public List<ReviewItem> collect(String brandName) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("collector.serpapi.api-key is not configured");
        }

        List<ReviewItem> items = new ArrayList<>();
        for (String query : queriesFor(brandName)) {
            try {
                String body = restClient.get()
                        .uri(baseUrl + "?q={q}&engine=google&api_key={key}&num={num}&hl={hl}",
                                query, apiKey, RESULTS_PER_QUERY, "zh-TW")
                        .retrieve()
                        .body(String.class);
                List<ReviewItem> results = parseOrganicResults(objectMapper.readTree(body == null ? "{}" : body));
                log.debug("[SerpApiCollector] '{}': {} results", query, results.size());
                items.addAll(results);
            } catch (Exception e) {
                log.warn("[SerpApiCollector] Query '{}' failed: {}", query, e.getMessage());
            }
        }
        return distinctByUrl(items);
    }

    static List<String> queriesFor(String brandName) {
        return QUERY_SUFFIXES.stream().map(suffix -> brandName + " " + suffix).toList();
    }

    List<ReviewItem> parseOrganicResults(JsonNode response) {
        List<ReviewItem> items = new ArrayList<>();
        for (JsonNode result : response.path("organic_results")) {
            String title = result.path("title").asText("");
            if (title.isEmpty()) {
                continue;
            }
            String snippet = result.path("snippet").asText("");
            String content = snippet.isEmpty()
                    ? MISSING_SNIPPET
                    : DcardCollector.truncate(snippet, SNIPPET_MAX_LENGTH);
            items.add(new ReviewItem(content, sourceId(), result.path("link").asText(""), AUTHOR, title, null));
        }
        return items;
    }

    static List<ReviewItem> distinctByUrl(List<ReviewItem> items) {
        Set<String> seen = new LinkedHashSet<>();
        List<ReviewItem> unique = new ArrayList<>();
        for (ReviewItem item : items) {
            if (!item.hasUrl() || seen.add(item.url())) {
                unique.add(item);
            }
        }
        return unique;
    }
}
