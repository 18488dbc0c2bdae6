package com.catalog.matching.rest.dto;

import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalScores;

/**
 * REST response DTO for a ranked candidate, exposing every signal score.
 */
public record MatchCandidateResponse(
        String productId,
        String sku,
        String name,
        String manufacturer,
        String category,
        double finalScore,
        String matchedVia,
        String reasoning,
        double vectorScore,
        double trigramScore,
        double fuzzyScore,
        double aliasScore,
        double learnedScore,
        String trainingExampleId
) {
    public static MatchCandidateResponse from(MatchCandidate candidate) {
        Product product = candidate.product();
        SignalScores scores = candidate.scores();
        return new MatchCandidateResponse(
                product.id(),
                product.sku(),
                product.name(),
                product.manufacturer(),
                product.category(),
                candidate.finalScore(),
                candidate.matchedVia().label(),
                candidate.reasoning(),
                scores.vector(),
                scores.trigram(),
                scores.fuzzy(),
                scores.alias(),
                scores.learned(),
                candidate.trainingExampleId()
        );
    }
}
