package com.brandmonitor.infrastructure.collector;

import com.brandmonitor.domain.review.model.ReviewItem;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SampleReviewCollectorTest {

    private SampleReviewCollector collector;

    @BeforeEach
    void setUp() throws IOException {
        Clock clock = Clock.fixed(Instant.parse("2025-05-10T12:00:00Z"), ZoneOffset.UTC);
        collector = new SampleReviewCollector(new ObjectMapper(), new DefaultResourceLoader(), clock,
                "classpath:collector/sample-reviews.json");
    }

    @Test
    @DisplayName("fixture reviews are served for a known brand")
    void known_brand() {
        List<ReviewItem> items = collector.collect("蝦皮");

        assertThat(items).hasSize(5);
        assertThat(items.get(0).url()).isEqualTo("https://sample.com/review/0");
        assertThat(items.get(4).url()).isEqualTo("https://sample.com/review/4");
        assertThat(items.get(0).title()).isEqualTo("蝦皮購物體驗不錯");
        assertThat(items).allSatisfy(item -> assertThat(item.text()).isNotBlank());
    }

    @Test
    @DisplayName("posting dates are spaced two days apart")
    void posted_at() {
        List<ReviewItem> items = collector.collect("Apple");

        assertThat(items).extracting(ReviewItem::postedAt).containsExactly(
                LocalDateTime.of(2025, 5, 10, 12, 0),
                LocalDateTime.of(2025, 5, 8, 12, 0));
    }

    @Test
    @DisplayName("unknown brand yields no items")
    void unknown_brand() {
        assertThat(collector.collect("NoSuchBrand")).isEmpty();
    }
}
