package com.brandmonitor.interfaces.api.keyword;

import com.brandmonitor.application.vocabulary.VocabularyService;
import com.brandmonitor.domain.vocabulary.model.KeywordEntry;
import com.brandmonitor.domain.vocabulary.model.PriorityTier;
import com.brandmonitor.domain.vocabulary.model.TierKeywords;
import com.brandmonitor.domain.vocabulary.model.VocabularyStats;
import com.brandmonitor.infrastructure.vocabulary.VocabularyDocumentMapper;
import com.brandmonitor.interfaces.api.dto.KeywordMutationResponse;
import com.brandmonitor.interfaces.api.dto.KeywordRequest;
import com.brandmonitor.interfaces.api.dto.MoveKeywordRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Vocabulary administration. Responses use the persisted document shape (tier keys such as {@code OPPORTUNITIES}).
 */
@RestController
@RequestMapping("/api/keywords")
@RequiredArgsConstructor
public class KeywordController {

    private final VocabularyService vocabularyService;
    private final VocabularyDocumentMapper documentMapper;

    @GetMapping("/all")
    public ResponseEntity<Map<String, Object>> getAll() {
        return ResponseEntity.ok(documentMapper.toDocument(vocabularyService.snapshot()));
    }

    @GetMapping("/category/{category}")
    public ResponseEntity<Map<String, Object>> getCategory(@PathVariable String category) {
        return ResponseEntity.ok(documentMapper.toTierDocument(vocabularyService.getTier(category)));
    }

    @GetMapping("/search")
    public ResponseEntity<Map<String, Object>> search(@RequestParam("q") String query) {
        Map<String, Object> results = new LinkedHashMap<>();
        for (Map.Entry<PriorityTier, TierKeywords> entry : vocabularyService.search(query).entrySet()) {
            results.put(entry.getKey().documentKey(), documentMapper.toTierDocument(entry.getValue()));
        }
        return ResponseEntity.ok(results);
    }

    @PostMapping("/add")
    public ResponseEntity<KeywordMutationResponse> add(@Valid @RequestBody KeywordRequest request) {
        KeywordEntry entry = vocabularyService.addTerm(request.category(), request.word(), request.weightOrDefault());
        return ResponseEntity.ok(mutation("Keyword added successfully", entry));
    }

    @PostMapping("/update")
    public ResponseEntity<KeywordMutationResponse> update(@Valid @RequestBody KeywordRequest request) {
        KeywordEntry entry = vocabularyService.updateTerm(request.category(), request.word(), request.weightOrDefault());
        return ResponseEntity.ok(mutation("Keyword updated successfully", entry));
    }

    @PostMapping("/delete")
    public ResponseEntity<KeywordMutationResponse> delete(@Valid @RequestBody KeywordRequest request) {
        vocabularyService.deleteTerm(request.category(), request.word());
        String category = PriorityTier.fromName(request.category())
                .map(PriorityTier::documentKey)
                .orElse(request.category());
        return ResponseEntity.ok(new KeywordMutationResponse(
                "Keyword deleted successfully", category, request.word().strip(), null));
    }

    @PostMapping("/move")
    public ResponseEntity<KeywordMutationResponse> move(@Valid @RequestBody MoveKeywordRequest request) {
        KeywordEntry entry = vocabularyService.moveTerm(
                request.fromCategory(), request.toCategory(), request.word(), request.weightOrDefault());
        String from = PriorityTier.fromName(request.fromCategory())
                .map(PriorityTier::documentKey)
                .orElse(request.fromCategory());
        String message = "Keyword moved from " + from + " to " + entry.tier().documentKey();
        return ResponseEntity.ok(mutation(message, entry));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        VocabularyStats stats = vocabularyService.stats();
        Map<String, Object> body = new LinkedHashMap<>(stats.perTierCount());
        body.put("TOTAL", stats.total());
        body.put("lastUpdated", stats.lastUpdated());
        return ResponseEntity.ok(body);
    }

    private static KeywordMutationResponse mutation(String message, KeywordEntry entry) {
        return new KeywordMutationResponse(message, entry.tier().documentKey(), entry.term(), entry.weight());
    }
}
