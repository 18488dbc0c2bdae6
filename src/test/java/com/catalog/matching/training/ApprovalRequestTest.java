package com.catalog.matching.training;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchQuality;
import com.catalog.matching.core.model.SignalScores;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalRequestTest {

    private static final CatalogScope SCOPE = CatalogScope.of("acme");

    @Test
    @DisplayName("Should default scores, quality and confidence")
    void testDefaults() {
        ApprovalRequest request = ApprovalRequest.of(SCOPE, "hex bolt", "p-1", null);

        assertEquals(SignalScores.ZERO, request.scores());
        assertEquals(MatchQuality.GOOD, request.quality());
        assertEquals(ApprovalRequest.DEFAULT_CONFIDENCE, request.confidence());
        assertNull(request.approvedBy());
    }

    @Test
    @DisplayName("Should reject missing text or product")
    void testRequiredFields() {
        assertThrows(IllegalArgumentException.class, () -> ApprovalRequest.of(SCOPE, " ", "p-1", null));
        assertThrows(IllegalArgumentException.class, () -> ApprovalRequest.of(SCOPE, null, "p-1", null));
        assertThrows(IllegalArgumentException.class, () -> ApprovalRequest.of(SCOPE, "hex bolt", "", null));
        assertThrows(NullPointerException.class, () -> ApprovalRequest.of(null, "hex bolt", "p-1", null));
    }

    @Test
    @DisplayName("Should reject out-of-range scores")
    void testRanges() {
        assertThrows(IllegalArgumentException.class, () ->
                new ApprovalRequest(SCOPE, "hex bolt", "p-1", null, 1.2, MatchQuality.GOOD, 0.8, null));
        assertThrows(IllegalArgumentException.class, () ->
                new ApprovalRequest(SCOPE, "hex bolt", "p-1", null, 0.5, MatchQuality.GOOD, -0.1, null));
    }

    @Test
    @DisplayName("Should build acks for stored and failed writes")
    void testAcks() {
        ApprovalAck stored = ApprovalAck.stored("ex-1", true, false);
        ApprovalAck failed = ApprovalAck.failed("timeout");

        assertTrue(stored.persisted());
        assertEquals("ex-1", stored.exampleId());
        assertNull(stored.message());
        assertFalse(failed.persisted());
        assertFalse(failed.created());
        assertEquals("timeout", failed.message());
    }
}
