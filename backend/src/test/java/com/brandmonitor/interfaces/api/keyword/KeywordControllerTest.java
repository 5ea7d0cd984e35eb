package com.brandmonitor.interfaces.api.keyword;

import com.brandmonitor.application.vocabulary.VocabularyService;
import com.brandmonitor.application.vocabulary.exception.DuplicateKeywordException;
import com.brandmonitor.application.vocabulary.exception.InvalidKeywordException;
import com.brandmonitor.application.vocabulary.exception.KeywordNotFoundException;
import com.brandmonitor.application.vocabulary.exception.TierNotFoundException;
import com.brandmonitor.application.vocabulary.exception.VocabularyUnavailableException;
import com.brandmonitor.domain.vocabulary.model.KeywordEntry;
import com.brandmonitor.domain.vocabulary.model.PriorityTier;
import com.brandmonitor.domain.vocabulary.model.TierKeywords;
import com.brandmonitor.domain.vocabulary.model.Vocabulary;
import com.brandmonitor.domain.vocabulary.model.VocabularyMetadata;
import com.brandmonitor.domain.vocabulary.model.VocabularyStats;
import com.brandmonitor.infrastructure.vocabulary.VocabularyDocumentMapper;
import com.brandmonitor.infrastructure.vocabulary.VocabularyStorageException;
import com.brandmonitor.interfaces.api.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class KeywordControllerTest {

    @Mock
    private VocabularyService vocabularyService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new KeywordController(vocabularyService, new VocabularyDocumentMapper()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("GET /all returns the persisted document shape")
        void all() throws Exception {
            Map<PriorityTier, TierKeywords> tiers = new EnumMap<>(PriorityTier.class);
            tiers.put(PriorityTier.OPPORTUNITY, new TierKeywords("leads", Map.of("代購", 2.0)));
            when(vocabularyService.snapshot())
                    .thenReturn(new Vocabulary(tiers, new VocabularyMetadata("2025-01-01 00:00:00", "ops")));

            mockMvc.perform(get("/api/keywords/all"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.OPPORTUNITIES.description").value("leads"))
                    .andExpect(jsonPath("$.OPPORTUNITIES.keywords['代購']").value(2.0))
                    .andExpect(jsonPath("$.CRITICAL.keywords").isEmpty())
                    .andExpect(jsonPath("$.metadata.lastUpdated").value("2025-01-01 00:00:00"))
                    .andExpect(jsonPath("$.metadata.maintainer").value("ops"));
        }

        @Test
        @DisplayName("GET /category/{c} for an unknown tier is 404")
        void unknown_category() throws Exception {
            when(vocabularyService.getTier("URGENT")).thenThrow(new TierNotFoundException("URGENT"));

            mockMvc.perform(get("/api/keywords/category/URGENT"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").exists())
                    .andExpect(jsonPath("$.code").value("CATEGORY_NOT_FOUND"));
        }

        @Test
        @DisplayName("GET /search keys results by document tier name")
        void search() throws Exception {
            Map<PriorityTier, TierKeywords> results = new LinkedHashMap<>();
            results.put(PriorityTier.OPPORTUNITY, new TierKeywords("leads", Map.of("代購", 2.0)));
            when(vocabularyService.search("代")).thenReturn(results);

            mockMvc.perform(get("/api/keywords/search").param("q", "代"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.OPPORTUNITIES.keywords['代購']").value(2.0))
                    .andExpect(jsonPath("$.CRITICAL").doesNotExist());
        }

        @Test
        @DisplayName("GET /stats is flat with TOTAL and lastUpdated")
        void stats() throws Exception {
            Map<String, Integer> perTier = new LinkedHashMap<>();
            perTier.put("CRITICAL", 2);
            perTier.put("STRATEGIC", 0);
            perTier.put("OPERATIONAL", 1);
            perTier.put("OPPORTUNITIES", 3);
            when(vocabularyService.stats()).thenReturn(new VocabularyStats(perTier, 6, "Unknown"));

            mockMvc.perform(get("/api/keywords/stats"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.CRITICAL").value(2))
                    .andExpect(jsonPath("$.OPPORTUNITIES").value(3))
                    .andExpect(jsonPath("$.TOTAL").value(6))
                    .andExpect(jsonPath("$.lastUpdated").value("Unknown"));
        }

        @Test
        @DisplayName("unreadable vocabulary is 503")
        void unavailable() throws Exception {
            when(vocabularyService.stats())
                    .thenThrow(new VocabularyUnavailableException("Vocabulary store is unreadable", null));

            mockMvc.perform(get("/api/keywords/stats"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.code").value("VOCABULARY_UNAVAILABLE"));
        }
    }

    @Nested
    @DisplayName("Mutations")
    class Mutations {

        @Test
        @DisplayName("POST /add defaults the weight to 1.0 and echoes the entry")
        void add() throws Exception {
            when(vocabularyService.addTerm("critical", "假貨", 1.0))
                    .thenReturn(new KeywordEntry(PriorityTier.CRITICAL, "假貨", 1.0));

            mockMvc.perform(post("/api/keywords/add")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"category\": \"critical\", \"word\": \"假貨\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Keyword added successfully"))
                    .andExpect(jsonPath("$.category").value("CRITICAL"))
                    .andExpect(jsonPath("$.word").value("假貨"))
                    .andExpect(jsonPath("$.weight").value(1.0));
        }

        @Test
        @DisplayName("duplicate add is 409")
        void duplicate() throws Exception {
            when(vocabularyService.addTerm("CRITICAL", "詐騙", 2.0))
                    .thenThrow(new DuplicateKeywordException("詐騙", "CRITICAL"));

            mockMvc.perform(post("/api/keywords/add")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"category\": \"CRITICAL\", \"word\": \"詐騙\", \"weight\": 2.0}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("DUPLICATE_KEYWORD"));
        }

        @Test
        @DisplayName("missing word is 400 without touching the service")
        void missing_word() throws Exception {
            mockMvc.perform(post("/api/keywords/add")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"category\": \"CRITICAL\", \"word\": \"  \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

            verifyNoInteractions(vocabularyService);
        }

        @Test
        @DisplayName("invalid category on a mutation is 400")
        void invalid_category() throws Exception {
            when(vocabularyService.addTerm(anyString(), anyString(), anyDouble()))
                    .thenThrow(new InvalidKeywordException("Unknown category: URGENT"));

            mockMvc.perform(post("/api/keywords/add")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"category\": \"URGENT\", \"word\": \"x\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Unknown category: URGENT"));
        }

        @Test
        @DisplayName("update of a missing term is 404")
        void update_missing() throws Exception {
            when(vocabularyService.updateTerm("STRATEGIC", "不存在", 1.0))
                    .thenThrow(new KeywordNotFoundException("不存在", "STRATEGIC"));

            mockMvc.perform(post("/api/keywords/update")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"category\": \"STRATEGIC\", \"word\": \"不存在\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("KEYWORD_NOT_FOUND"));
        }

        @Test
        @DisplayName("unknown category on update, delete and move source is 404")
        void unknown_category_not_found() throws Exception {
            when(vocabularyService.updateTerm("URGENT", "詐騙", 1.0))
                    .thenThrow(new TierNotFoundException("URGENT"));
            doThrow(new TierNotFoundException("URGENT")).when(vocabularyService).deleteTerm("URGENT", "詐騙");
            when(vocabularyService.moveTerm("URGENT", "CRITICAL", "詐騙", 1.0))
                    .thenThrow(new TierNotFoundException("URGENT"));

            mockMvc.perform(post("/api/keywords/update")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"category\": \"URGENT\", \"word\": \"詐騙\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("CATEGORY_NOT_FOUND"));
            mockMvc.perform(post("/api/keywords/delete")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"category\": \"URGENT\", \"word\": \"詐騙\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("CATEGORY_NOT_FOUND"));
            mockMvc.perform(post("/api/keywords/move")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"from_category\": \"URGENT\", \"to_category\": \"CRITICAL\","
                                    + " \"word\": \"詐騙\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("Category URGENT not found"));
        }

        @Test
        @DisplayName("POST /delete echoes the canonical category")
        void delete() throws Exception {
            mockMvc.perform(post("/api/keywords/delete")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"category\": \"opportunity\", \"word\": \"代購\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.category").value("OPPORTUNITIES"))
                    .andExpect(jsonPath("$.weight").doesNotExist());

            verify(vocabularyService).deleteTerm("opportunity", "代購");
        }

        @Test
        @DisplayName("POST /move reads snake_case fields")
        void move() throws Exception {
            when(vocabularyService.moveTerm("OPPORTUNITIES", "STRATEGIC", "代購", 1.5))
                    .thenReturn(new KeywordEntry(PriorityTier.STRATEGIC, "代購", 1.5));

            mockMvc.perform(post("/api/keywords/move")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"from_category\": \"OPPORTUNITIES\", \"to_category\": \"STRATEGIC\","
                                    + " \"word\": \"代購\", \"weight\": 1.5}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Keyword moved from OPPORTUNITIES to STRATEGIC"))
                    .andExpect(jsonPath("$.category").value("STRATEGIC"));
        }

        @Test
        @DisplayName("storage failure is 500 with a generic message")
        void storage_failure() throws Exception {
            when(vocabularyService.addTerm("CRITICAL", "新詞", 1.0))
                    .thenThrow(new VocabularyStorageException("disk full at /secret/path"));

            mockMvc.perform(post("/api/keywords/add")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"category\": \"CRITICAL\", \"word\": \"新詞\"}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.error").value("Error saving keywords"));
        }
    }
}
