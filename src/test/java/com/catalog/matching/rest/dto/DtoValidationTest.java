package com.catalog.matching.rest.dto;

import com.catalog.matching.api.BatchMatchItem;
import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.MatchQuality;
import com.catalog.matching.core.model.MatchSource;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalScores;
import com.catalog.matching.training.ApprovalRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DtoValidationTest {

    // ========== MatchRequest Tests ==========

    @Test
    @DisplayName("Should create valid MatchRequest")
    void testValidMatchRequest() {
        MatchRequest req = new MatchRequest("hex bolt zinc", 5, 0.4);
        assertEquals("hex bolt zinc", req.text());
        assertEquals(5, req.limit());
    }

    @Test
    @DisplayName("Should reject MatchRequest with null text")
    void testMatchRequestNullText() {
        assertThrows(IllegalArgumentException.class, () -> new MatchRequest(null, null, null));
    }

    @Test
    @DisplayName("Should reject MatchRequest with blank text")
    void testMatchRequestBlankText() {
        assertThrows(IllegalArgumentException.class, () -> new MatchRequest("   ", null, null));
    }

    // ========== BatchMatchRequest Tests ==========

    @Test
    @DisplayName("Should create valid BatchMatchRequest")
    void testValidBatchRequest() {
        BatchMatchRequest req = new BatchMatchRequest(List.of("hex bolt", "safety goggles"), null, null);
        assertEquals(2, req.texts().size());
    }

    @Test
    @DisplayName("Should reject BatchMatchRequest with empty texts")
    void testBatchRequestEmpty() {
        assertThrows(IllegalArgumentException.class, () -> new BatchMatchRequest(List.of(), null, null));
        assertThrows(IllegalArgumentException.class, () -> new BatchMatchRequest(null, null, null));
    }

    @Test
    @DisplayName("Should reject BatchMatchRequest over 1000 texts")
    void testBatchRequestTooLarge() {
        List<String> texts = new ArrayList<>(Collections.nCopies(1001, "hex bolt"));
        assertThrows(IllegalArgumentException.class, () -> new BatchMatchRequest(texts, null, null));
    }

    // ========== ApprovalRequestDto Tests ==========

    @Test
    @DisplayName("Should convert ApprovalRequestDto with defaults")
    void testApprovalDefaults() {
        ApprovalRequestDto dto = new ApprovalRequestDto("gr. 8 hx hd cap scr", "p-56", null, null, null,
                null, null, null, null, null, null);

        ApprovalRequest request = dto.toRequest(CatalogScope.of("acme"));

        assertEquals(MatchQuality.GOOD, request.quality());
        assertEquals(ApprovalRequest.DEFAULT_CONFIDENCE, request.confidence());
        assertEquals(SignalScores.ZERO, request.scores());
        assertEquals(0.0, request.finalScore());
    }

    @Test
    @DisplayName("Should parse ApprovalRequestDto quality ignoring case")
    void testApprovalQualityCase() {
        ApprovalRequestDto dto = new ApprovalRequestDto("goggles", "p-gog", " fair ", 0.5, 0.4,
                null, 0.4, null, null, null, "reviewer");

        ApprovalRequest request = dto.toRequest(CatalogScope.of("acme"));

        assertEquals(MatchQuality.FAIR, request.quality());
        assertEquals(0.4, request.scores().trigram());
        assertEquals("reviewer", request.approvedBy());
    }

    @Test
    @DisplayName("Should reject ApprovalRequestDto without required fields")
    void testApprovalRequiredFields() {
        assertThrows(IllegalArgumentException.class, () ->
                new ApprovalRequestDto(null, "p-gog", null, null, null, null, null, null, null, null, null));
        assertThrows(IllegalArgumentException.class, () ->
                new ApprovalRequestDto("goggles", " ", null, null, null, null, null, null, null, null, null));
    }

    @Test
    @DisplayName("Should reject ApprovalRequestDto with out of range confidence")
    void testApprovalConfidenceRange() {
        ApprovalRequestDto dto = new ApprovalRequestDto("goggles", "p-gog", null, 1.5, null,
                null, null, null, null, null, null);
        assertThrows(IllegalArgumentException.class, () -> dto.toRequest(CatalogScope.of("acme")));
    }

    // ========== WeightUpdateRequest Tests ==========

    @Test
    @DisplayName("Should accept a zero weight")
    void testZeroWeight() {
        assertEquals(0.0, new WeightUpdateRequest(0.0, null).weight());
    }

    @Test
    @DisplayName("Should reject missing, negative and NaN weights")
    void testInvalidWeights() {
        assertThrows(IllegalArgumentException.class, () -> new WeightUpdateRequest(null, "ops"));
        assertThrows(IllegalArgumentException.class, () -> new WeightUpdateRequest(-0.1, "ops"));
        assertThrows(IllegalArgumentException.class, () -> new WeightUpdateRequest(Double.NaN, "ops"));
    }

    // ========== Response Mapping Tests ==========

    @Test
    @DisplayName("Should map MatchCandidate to response")
    void testCandidateResponse() {
        MatchCandidate candidate = new MatchCandidate(
                new Product("p-56", "56X212C8", "Hex Cap Screw Grade 8 5/16-18 x 2-1/2", null, "Fasteners"),
                SignalScores.uniform(1.0), 1.0, MatchSource.TRAINING_EXACT, "approved example", "ex-9");

        MatchCandidateResponse response = MatchCandidateResponse.from(candidate);

        assertEquals("p-56", response.productId());
        assertEquals("training_exact", response.matchedVia());
        assertEquals("ex-9", response.trainingExampleId());
        assertEquals(1.0, response.vectorScore());
        assertNull(response.manufacturer());
    }

    @Test
    @DisplayName("Should map BatchMatchItem to response")
    void testBatchItemResponse() {
        BatchMatchItemResponse response = BatchMatchItemResponse.from(new BatchMatchItem(3, "qqqq", List.of()));

        assertEquals(3, response.queryIndex());
        assertEquals("qqqq", response.queryText());
        assertTrue(response.candidates().isEmpty());
    }

    // ========== ErrorResponse Tests ==========

    @Test
    @DisplayName("Should build error responses with status codes")
    void testErrorResponses() {
        assertEquals(400, ErrorResponse.badRequest("bad", "/p").status());
        assertEquals(404, ErrorResponse.notFound("missing", "/p").status());
        assertEquals(500, ErrorResponse.internalError("boom", "/p").status());
        ErrorResponse unavailable = ErrorResponse.serviceUnavailable("down", "/p");
        assertEquals(503, unavailable.status());
        assertEquals("Service Unavailable", unavailable.error());
        assertNotNull(unavailable.timestamp());
    }
}
