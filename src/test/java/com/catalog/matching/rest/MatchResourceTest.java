package com.catalog.matching.rest;

import com.catalog.matching.api.BatchMatchItem;
import com.catalog.matching.api.ProductMatcher;
import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.MatchSource;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalScores;
import com.catalog.matching.rest.dto.BatchMatchItemResponse;
import com.catalog.matching.rest.dto.BatchMatchRequest;
import com.catalog.matching.rest.dto.ErrorResponse;
import com.catalog.matching.rest.dto.MatchCandidateResponse;
import com.catalog.matching.rest.dto.MatchRequest;
import com.catalog.matching.store.CatalogUnavailableException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("MatchResource Tests")
class MatchResourceTest {

    private static final Product GOGGLES = new Product("p-gog", "SG-100", "Safety Goggles Clear", "3M", "PPE");

    private ProductMatcher matcher;
    private MatchResource resource;

    @BeforeEach
    void setUp() {
        matcher = mock(ProductMatcher.class);
        resource = new MatchResource(matcher);
    }

    private static MatchCandidate candidate() {
        return new MatchCandidate(GOGGLES, new SignalScores(0.0, 0.9, 0.8, 1.0, 0.0), 0.87,
                MatchSource.ALIAS, "alias match", null);
    }

    @Nested
    @DisplayName("Single match")
    class SingleMatch {

        @Test
        @DisplayName("Should return candidates with every signal score")
        @SuppressWarnings("unchecked")
        void shouldReturnCandidates() {
            when(matcher.match(CatalogScope.of("acme"), "safety goggles", 5, 0.5))
                    .thenReturn(List.of(candidate()));

            Response response = resource.match("acme", new MatchRequest("safety goggles", 5, 0.5));

            assertEquals(200, response.getStatus());
            Map<String, Object> body = (Map<String, Object>) response.getEntity();
            assertEquals(1, body.get("total"));
            List<MatchCandidateResponse> candidates = (List<MatchCandidateResponse>) body.get("candidates");
            MatchCandidateResponse first = candidates.get(0);
            assertEquals("p-gog", first.productId());
            assertEquals("SG-100", first.sku());
            assertEquals("alias", first.matchedVia());
            assertEquals(0.87, first.finalScore());
            assertEquals(1.0, first.aliasScore());
            assertEquals(0.9, first.trigramScore());
        }

        @Test
        @DisplayName("Should pass null limit and threshold through to the matcher")
        void shouldPassDefaults() {
            when(matcher.match(any(), any(), any(), any())).thenReturn(List.of());

            Response response = resource.match("acme", new MatchRequest("goggles", null, null));

            assertEquals(200, response.getStatus());
            verify(matcher).match(CatalogScope.of("acme"), "goggles", null, null);
        }

        @Test
        @DisplayName("Should return 400 for a missing body")
        void shouldRejectMissingBody() {
            Response response = resource.match("acme", null);

            assertEquals(400, response.getStatus());
            ErrorResponse error = (ErrorResponse) response.getEntity();
            assertEquals("request body is required", error.message());
            assertEquals("/api/v1/matches", error.path());
        }

        @Test
        @DisplayName("Should return 400 for a blank scope header")
        void shouldRejectBlankScope() {
            Response response = resource.match("  ", new MatchRequest("goggles", null, null));

            assertEquals(400, response.getStatus());
        }

        @Test
        @DisplayName("Should return 503 when the catalog is unavailable")
        void shouldMapCatalogUnavailable() {
            when(matcher.match(any(), any(), any(), any()))
                    .thenThrow(new CatalogUnavailableException("catalog down"));

            Response response = resource.match("acme", new MatchRequest("goggles", null, null));

            assertEquals(503, response.getStatus());
            assertEquals(503, ((ErrorResponse) response.getEntity()).status());
        }

        @Test
        @DisplayName("Should return 500 without leaking the exception message")
        void shouldMapUnexpectedFailure() {
            when(matcher.match(any(), any(), any(), any()))
                    .thenThrow(new IllegalStateException("secret internals"));

            Response response = resource.match("acme", new MatchRequest("goggles", null, null));

            assertEquals(500, response.getStatus());
            ErrorResponse error = (ErrorResponse) response.getEntity();
            assertFalse(error.message().contains("secret"));
        }
    }

    @Nested
    @DisplayName("Batch match")
    class BatchMatch {

        @Test
        @DisplayName("Should return one result per text in submission order")
        @SuppressWarnings("unchecked")
        void shouldReturnResultsInOrder() {
            List<String> texts = List.of("goggles", "qqqq");
            when(matcher.matchBatch(eq(CatalogScope.of("acme")), eq(texts), eq(3), eq(null)))
                    .thenReturn(List.of(
                            new BatchMatchItem(0, "goggles", List.of(candidate())),
                            new BatchMatchItem(1, "qqqq", List.of())));

            Response response = resource.matchBatch("acme", new BatchMatchRequest(texts, 3, null));

            assertEquals(200, response.getStatus());
            Map<String, Object> body = (Map<String, Object>) response.getEntity();
            assertEquals(2, body.get("totalProcessed"));
            List<BatchMatchItemResponse> results = (List<BatchMatchItemResponse>) body.get("results");
            assertEquals(0, results.get(0).queryIndex());
            assertEquals("p-gog", results.get(0).candidates().get(0).productId());
            assertEquals(1, results.get(1).queryIndex());
            assertTrue(results.get(1).candidates().isEmpty());
        }

        @Test
        @DisplayName("Should return 400 for a missing body")
        void shouldRejectMissingBody() {
            Response response = resource.matchBatch("acme", null);

            assertEquals(400, response.getStatus());
            assertEquals("/api/v1/matches/batch", ((ErrorResponse) response.getEntity()).path());
        }

        @Test
        @DisplayName("Should return 503 when the catalog is unavailable")
        void shouldMapCatalogUnavailable() {
            when(matcher.matchBatch(any(), anyList(), any(), any()))
                    .thenThrow(new CatalogUnavailableException("catalog down"));

            Response response = resource.matchBatch("acme", new BatchMatchRequest(List.of("goggles"), null, null));

            assertEquals(503, response.getStatus());
        }
    }
}
