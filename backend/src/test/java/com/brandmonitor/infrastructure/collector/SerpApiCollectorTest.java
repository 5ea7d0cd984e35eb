package com.brandmonitor.infrastructure.collector;

import com.brandmonitor.domain.review.model.ReviewItem;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerpApiCollectorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("organic results without a title are skipped; missing snippets get a placeholder")
    void parse_organic_results() throws Exception {
        SerpApiCollector collector = collector("key");
        String response = """
                {"organic_results": [
                  {"title": "蝦皮評價", "link": "https://a.example/1", "snippet": "物流很快"},
                  {"title": "", "link": "https://a.example/2", "snippet": "沒有標題"},
                  {"title": "蝦皮缺點", "link": "https://a.example/3"}
                ]}
                """;

        List<ReviewItem> items = collector.parseOrganicResults(objectMapper.readTree(response));

        assertThat(items).extracting(ReviewItem::url).containsExactly("https://a.example/1", "https://a.example/3");
        assertThat(items.get(0).text()).isEqualTo("物流很快");
        assertThat(items.get(1).text()).isEqualTo("(無摘要)");
        assertThat(items.get(0).author()).isEqualTo("Google Search");
        assertThat(items.get(0).title()).isEqualTo("蝦皮評價");
    }

    @Test
    @DisplayName("a response without organic results yields nothing")
    void no_results() throws Exception {
        assertThat(collector("key").parseOrganicResults(objectMapper.readTree("{}"))).isEmpty();
    }

    @Test
    @DisplayName("queries combine the brand with the fixed suffixes")
    void queries() {
        assertThat(SerpApiCollector.queriesFor("Apple"))
                .containsExactly("Apple 評論", "Apple 缺點", "Apple 品質", "Apple 不好", "Apple review");
    }

    @Test
    @DisplayName("results are deduplicated by url, first kept")
    void distinct_by_url() {
        List<ReviewItem> items = SerpApiCollector.distinctByUrl(List.of(
                new ReviewItem("一", "serpapi", "u1", ""),
                new ReviewItem("二", "serpapi", "u1", ""),
                new ReviewItem("三", "serpapi", "u2", "")));

        assertThat(items).extracting(ReviewItem::text).containsExactly("一", "三");
    }

    @Test
    @DisplayName("results without a link are all kept")
    void distinct_by_url_keeps_empty_links() {
        List<ReviewItem> items = SerpApiCollector.distinctByUrl(List.of(
                new ReviewItem("一", "serpapi", "", ""),
                new ReviewItem("二", "serpapi", "", ""),
                new ReviewItem("三", "serpapi", "u1", "")));

        assertThat(items).extracting(ReviewItem::text).containsExactly("一", "二", "三");
    }

    @Test
    @DisplayName("missing api key fails the collector")
    void missing_api_key() {
        assertThatThrownBy(() -> collector("").collect("Apple"))
                .isInstanceOf(IllegalStateException.class);
    }

    private SerpApiCollector collector(String apiKey) {
        return new SerpApiCollector(RestClient.create(), objectMapper, "https://serpapi.com/search", apiKey);
    }
}
