package com.catalog.matching.tier;

import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.MatchSource;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.retrieval.CandidateRetriever;
import com.catalog.matching.retrieval.RetrievalMode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tier 3: weighted multi-signal scoring over strictly retrieved candidates, filtered by the
 * requested threshold.
 */
public class AlgorithmicTier implements MatchTier {

    static final String NAME = "algorithmic";

    private final CandidateRetriever retriever;
    private final CandidateScorer scorer;

    public AlgorithmicTier(CandidateRetriever retriever, CandidateScorer scorer) {
        this.retriever = retriever;
        this.scorer = scorer;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<MatchCandidate> evaluate(MatchContext context) {
        List<Product> products = retriever.retrieve(context.query(), RetrievalMode.STRICT);
        return scorer.score(context.query(), products).stream()
                .filter(s -> s.combined() >= context.threshold())
                .map(s -> {
                    MatchSource source = CandidateScorer.dominantSignal(s.scores());
                    return s.toCandidate(source, s.combined(),
                            CandidateScorer.explain(source, s.scores(), s.combined()));
                })
                .sorted(CandidateOrdering.BY_SCORE)
                .limit(context.limit())
                .collect(Collectors.toList());
    }
}
