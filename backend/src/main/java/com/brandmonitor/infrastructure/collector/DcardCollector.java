package com.brandmonitor.infrastructure.collector;

import com.brandmonitor.domain.review.model.ReviewItem;
import com.brandmonitor.domain.review.service.SourceCollector;
import com.brandmonitor.infrastructure.nlp.preprocessing.ReviewTextNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Dcard forum collector. Reads the newest posts of each configured forum and keeps those mentioning the brand.
 * A forum that fails is logged and skipped.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "collector.dcard.enabled", havingValue = "true")
public class DcardCollector implements SourceCollector {

    static final int CONTENT_MAX_LENGTH = 500;
    static final int POSTS_PER_FORUM = 30;

    private static final ReviewTextNormalizer TEXT_NORMALIZER = new ReviewTextNormalizer();

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final List<String> forums;

    public DcardCollector(RestClient collectorRestClient,
                          ObjectMapper objectMapper,
                          @Value("${collector.dcard.base-url:https://www.dcard.tw/api/v2}") String baseUrl,
                          @Value("${collector.dcard.forums:all,recommend,shopping,bargain}") List<String> forums) {
        this.restClient = collectorRestClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.forums = List.copyOf(forums);
    }

    @Override
    public String sourceId() {
        return "dcard";
    }

    @Override
    public List<ReviewItem> collect(String brandName) {
        List<ReviewItem> items = new ArrayList<>();
        for (String forum : forums) {
            try {
                String body = restClient.get()
                        .uri(baseUrl + "/forums/{forum}/posts?limit={limit}&sort=new", forum, POSTS_PER_FORUM)
                        .retrieve()
                        .body(String.class);
                List<ReviewItem> forumItems = parsePosts(objectMapper.readTree(body == null ? "[]" : body),
                        forum, brandName);
                log.debug("[DcardCollector] {}: {} matching posts", forum, forumItems.size());
                items.addAll(forumItems);
            } catch (Exception e) {
                log.warn("[DcardCollector] Forum '{}' failed: {}", forum, e.getMessage());
            }
        }
        return items;
    }

    List<ReviewItem> parsePosts(JsonNode posts, String forum, String brandName) {
        List<ReviewItem> items = new ArrayList<>();
        if (posts == null || !posts.isArray()) {
            return items;
        }
        for (JsonNode post : posts) {
            String title = post.path("title").asText("");
            String content = post.path("content").asText("");
            if (!mentionsBrand(title + " " + content, brandName)) {
                continue;
            }
            items.add(new ReviewItem(
                    truncate(content, CONTENT_MAX_LENGTH),
                    sourceId(),
                    String.format("https://www.dcard.tw/f/%s/p/%s", forum, post.path("id").asText("")),
                    post.path("author").path("name").asText("Anonymous"),
                    title,
                    parseTimestamp(post.path("createdAt").asText(null))));
        }
        return items;
    }

    static boolean mentionsBrand(String text, String brandName) {
        return text.toLowerCase(Locale.ROOT).contains(brandName.toLowerCase(Locale.ROOT));
    }

    static LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.debug("[DcardCollector] Unparseable createdAt '{}'", value);
            return null;
        }
    }

    static String truncate(String text, int max) {
        return TEXT_NORMALIZER.truncate(text, max);
    }
}
