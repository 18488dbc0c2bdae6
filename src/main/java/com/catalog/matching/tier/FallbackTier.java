package com.catalog.matching.tier;

import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.MatchSource;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.retrieval.CandidateRetriever;
import com.catalog.matching.retrieval.RetrievalMode;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tier 4: last resort. Relaxed retrieval, same scoring, and scores floored at the requested
 * threshold so a reviewer still gets something to look at. May return nothing.
 */
public class FallbackTier implements MatchTier {

    static final String NAME = "fallback";

    private static final Comparator<CandidateScorer.ScoredProduct> BY_COMBINED =
            Comparator.comparingDouble(CandidateScorer.ScoredProduct::combined).reversed()
                    .thenComparing(s -> s.product().name())
                    .thenComparing(s -> s.product().sku(), Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(s -> s.product().id());

    private final CandidateRetriever retriever;
    private final CandidateScorer scorer;

    public FallbackTier(CandidateRetriever retriever, CandidateScorer scorer) {
        this.retriever = retriever;
        this.scorer = scorer;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<MatchCandidate> evaluate(MatchContext context) {
        List<Product> products = retriever.retrieve(context.query(), RetrievalMode.RELAXED);
        // ordered on the raw combined score: floored finals tie at the threshold
        return scorer.score(context.query(), products).stream()
                .sorted(BY_COMBINED)
                .limit(context.limit())
                .map(s -> {
                    double finalScore = Math.max(s.combined(), context.threshold());
                    return s.toCandidate(MatchSource.FALLBACK_FUZZY, finalScore,
                            CandidateScorer.explain(MatchSource.FALLBACK_FUZZY, s.scores(), s.combined()));
                })
                .collect(Collectors.toList());
    }
}
