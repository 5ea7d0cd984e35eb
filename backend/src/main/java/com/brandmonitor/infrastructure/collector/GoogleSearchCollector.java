package com.brandmonitor.infrastructure.collector;

import com.brandmonitor.domain.review.model.ReviewItem;
import com.brandmonitor.domain.review.service.SourceCollector;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scrapes the Google results page directly. Fragile by nature: Google changes its markup and
 * throttles clients, so this collector is off unless enabled.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "collector.google.enabled", havingValue = "true")
public class GoogleSearchCollector implements SourceCollector {

    static final int MAX_QUERIES = 5;
    static final int DESCRIPTION_MAX_LENGTH = 500;
    static final String AUTHOR = "Google Search";
    private static final String REDIRECT_PREFIX = "/url?q=";

    private final RestClient restClient;
    private final String baseUrl;
    private final List<String> querySuffixes;

    public GoogleSearchCollector(RestClient collectorRestClient,
                                 @Value("${collector.google.base-url:https://www.google.com/search}") String baseUrl,
                                 @Value("${collector.google.query-suffixes:評論,review,詐騙,退貨,客服}") List<String> querySuffixes) {
        this.restClient = collectorRestClient;
        this.baseUrl = baseUrl;
        this.querySuffixes = List.copyOf(querySuffixes);
    }

    @Override
    public String sourceId() {
        return "google";
    }

    @Override
    public List<ReviewItem> collect(String brandName) {
        List<ReviewItem> items = new ArrayList<>();
        for (String query : queriesFor(brandName)) {
            try {
                String html = restClient.get()
                        .uri(baseUrl + "?q={q}&num={num}", query, 10)
                        .retrieve()
                        .body(String.class);
                List<ReviewItem> results = parseResults(html == null ? "" : html, query, brandName);
                log.debug("[GoogleSearchCollector] '{}': {} relevant results", query, results.size());
                items.addAll(results);
            } catch (Exception e) {
                log.warn("[GoogleSearchCollector] Query '{}' failed: {}", query, e.getMessage());
            }
        }
        return SerpApiCollector.distinctByUrl(items);
    }

    List<String> queriesFor(String brandName) {
        Set<String> queries = new LinkedHashSet<>();
        for (String suffix : querySuffixes) {
            if (!suffix.isBlank()) {
                queries.add(brandName + " " + suffix.strip());
            }
        }
        return queries.stream().limit(MAX_QUERIES).toList();
    }

    List<ReviewItem> parseResults(String html, String query, String brandName) {
        Document document = Jsoup.parse(html);
        List<ReviewItem> items = new ArrayList<>();

        for (Element result : document.select("div.g")) {
            Element heading = result.selectFirst("h3");
            Element link = result.selectFirst("a[href]");
            if (heading == null || link == null) {
                continue;
            }
            String title = heading.text().strip();
            String url = unwrapRedirect(link.attr("href"));

            Element snippet = result.selectFirst("div.s, div.VwiC3b");
            String description = snippet == null
                    ? ""
                    : DcardCollector.truncate(snippet.text().strip(), DESCRIPTION_MAX_LENGTH);

            if (!isRelevant(title, description, query, brandName)) {
                continue;
            }
            items.add(new ReviewItem(description, sourceId(), url, AUTHOR, title, null));
        }
        return items;
    }

    static String unwrapRedirect(String href) {
        if (!href.startsWith(REDIRECT_PREFIX)) {
            return href;
        }
        String target = href.substring(REDIRECT_PREFIX.length());
        int ampersand = target.indexOf('&');
        if (ampersand >= 0) {
            target = target.substring(0, ampersand);
        }
        return URLDecoder.decode(target, StandardCharsets.UTF_8);
    }

    static boolean isRelevant(String title, String description, String query, String brandName) {
        String fullText = (title + " " + description).toLowerCase(Locale.ROOT);
        if (!fullText.contains(brandName.toLowerCase(Locale.ROOT))) {
            return false;
        }
        for (String word : query.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (word.length() > 2 && fullText.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
