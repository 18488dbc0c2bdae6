package com.catalog.matching.tier;

import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.MatchSource;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalScores;
import com.catalog.matching.signal.QueryContext;
import com.catalog.matching.signal.SignalEvaluator;
import com.catalog.matching.similarity.SignalWeights;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores retrieved products with every signal and combines them with the configured weights.
 */
public class CandidateScorer {

    static final double LEARNED_DOMINANT = 0.6;
    static final double ALIAS_DOMINANT = 0.7;
    static final double VECTOR_DOMINANT = 0.8;

    private final SignalEvaluator signalEvaluator;
    private final SignalWeights weights;

    public CandidateScorer(SignalEvaluator signalEvaluator, SignalWeights weights) {
        this.signalEvaluator = signalEvaluator;
        this.weights = weights;
    }

    public List<ScoredProduct> score(QueryContext query, List<Product> products) {
        List<ScoredProduct> scored = new ArrayList<>(products.size());
        for (Product product : products) {
            SignalScores scores = signalEvaluator.evaluate(query, product);
            scored.add(new ScoredProduct(product, scores, weights.combine(scores)));
        }
        return scored;
    }

    /**
     * Label naming the signal that carried the match.
     */
    public static MatchSource dominantSignal(SignalScores scores) {
        if (scores.learned() > LEARNED_DOMINANT) {
            return MatchSource.LEARNED;
        }
        if (scores.alias() > ALIAS_DOMINANT) {
            return MatchSource.ALIAS;
        }
        if (scores.vector() > VECTOR_DOMINANT && scores.vector() >= Math.max(scores.trigram(), scores.fuzzy())) {
            return MatchSource.VECTOR;
        }
        if (scores.fuzzy() > scores.trigram()) {
            return MatchSource.FUZZY;
        }
        return MatchSource.TRIGRAM;
    }

    public static String explain(MatchSource source, SignalScores scores, double finalScore) {
        return String.format(Locale.ROOT,
                "%s match: trigram=%.2f fuzzy=%.2f alias=%.2f learned=%.2f vector=%.2f, combined %.2f",
                source.label(), scores.trigram(), scores.fuzzy(), scores.alias(), scores.learned(),
                scores.vector(), finalScore);
    }

    /**
     * A product with its signal breakdown and weighted score.
     */
    public record ScoredProduct(Product product, SignalScores scores, double combined) {

        public MatchCandidate toCandidate(MatchSource source, double finalScore, String reasoning) {
            return new MatchCandidate(product, scores, finalScore, source, reasoning, null);
        }
    }
}
