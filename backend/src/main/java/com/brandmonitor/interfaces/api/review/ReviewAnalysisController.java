package com.brandmonitor.interfaces.api.review;

import com.brandmonitor.application.review.ReviewAnalysisAppService;
import com.brandmonitor.domain.classification.model.ClassificationResult;
import com.brandmonitor.domain.classification.model.Sentiment;
import com.brandmonitor.domain.review.model.AggregateReport;
import com.brandmonitor.domain.review.model.ClassifiedReview;
import com.brandmonitor.domain.review.model.ReviewItem;
import com.brandmonitor.infrastructure.nlp.preprocessing.ReviewTextNormalizer;
import com.brandmonitor.interfaces.api.dto.AnalyzeRequest;
import com.brandmonitor.interfaces.api.dto.AnalyzeResponse;
import com.brandmonitor.interfaces.api.dto.ClassifyRequest;
import com.brandmonitor.interfaces.api.dto.ClassifyResponse;
import com.brandmonitor.interfaces.api.dto.ReviewResponse;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ReviewAnalysisController {

    static final int TITLE_MAX_LENGTH = 30;

    private final ReviewAnalysisAppService analysisAppService;
    private final ReviewTextNormalizer textNormalizer;
    private final int contentMaxLength;

    public ReviewAnalysisController(ReviewAnalysisAppService analysisAppService,
                                    ReviewTextNormalizer textNormalizer,
                                    @Value("${report.content-max-length:300}") int contentMaxLength) {
        this.analysisAppService = analysisAppService;
        this.textNormalizer = textNormalizer;
        this.contentMaxLength = contentMaxLength;
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalyzeResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
        String brandName = request.brandName().strip();
        AggregateReport report = analysisAppService.analyze(brandName, request.text());
        return ResponseEntity.ok(toResponse(brandName, report));
    }

    @PostMapping("/classify")
    public ResponseEntity<ClassifyResponse> classify(@Valid @RequestBody ClassifyRequest request) {
        return ResponseEntity.ok(ClassifyResponse.from(analysisAppService.classify(request.text())));
    }

    AnalyzeResponse toResponse(String brandName, AggregateReport report) {
        List<ReviewResponse> reviews = report.items().stream()
                .map(this::toReview)
                .toList();

        Map<String, Integer> sentiments = new LinkedHashMap<>();
        for (Map.Entry<Sentiment, Integer> entry : report.sentimentDistribution().entrySet()) {
            sentiments.put(entry.getKey().label(), entry.getValue());
        }

        return new AnalyzeResponse(brandName, report.total(), reviews, sentiments, report.priorityDistribution());
    }

    private ReviewResponse toReview(ClassifiedReview review) {
        ReviewItem item = review.item();
        ClassificationResult result = review.classification();
        String title = item.title() != null && !item.title().isBlank()
                ? item.title()
                : textNormalizer.titleOf(item.text(), TITLE_MAX_LENGTH);

        return new ReviewResponse(
                title,
                textNormalizer.truncate(item.text(), contentMaxLength),
                item.sourceId(),
                item.url(),
                result.sentiment().label(),
                result.score(),
                result.confidence(),
                result.category().label(),
                result.priority(),
                result.matchedKeywords());
    }
}
