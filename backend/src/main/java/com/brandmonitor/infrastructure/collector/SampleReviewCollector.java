package com.brandmonitor.infrastructure.collector;

import com.brandmonitor.domain.review.model.ReviewItem;
import com.brandmonitor.domain.review.service.SourceCollector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline collector serving bundled fixture reviews per brand. Lets the whole pipeline run without network access.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "collector.sample.enabled", havingValue = "true", matchIfMissing = true)
public class SampleReviewCollector implements SourceCollector {

    static final String URL_PATTERN = "https://sample.com/review/%d";

    private final JsonNode fixtures;
    private final Clock clock;

    public SampleReviewCollector(ObjectMapper objectMapper,
                                 ResourceLoader resourceLoader,
                                 Clock clock,
                                 @Value("${collector.sample.resource:classpath:collector/sample-reviews.json}") String location)
            throws IOException {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            this.fixtures = objectMapper.readTree(in);
        }
        this.clock = clock;
    }

    @Override
    public String sourceId() {
        return "sample";
    }

    @Override
    public List<ReviewItem> collect(String brandName) {
        JsonNode reviews = fixtures.path(brandName);
        if (!reviews.isArray()) {
            log.debug("[SampleCollector] No sample reviews for '{}'", brandName);
            return List.of();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<ReviewItem> items = new ArrayList<>();
        for (int i = 0; i < reviews.size(); i++) {
            JsonNode review = reviews.get(i);
            items.add(new ReviewItem(
                    review.path("content").asText(""),
                    review.path("source").asText(sourceId()),
                    String.format(URL_PATTERN, i),
                    review.path("author").asText(""),
                    review.path("title").asText(null),
                    now.minusDays(i * 2L)));
        }
        return items;
    }
}
