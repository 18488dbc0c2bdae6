package com.catalog.matching.tier;

import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.MatchSource;
import com.catalog.matching.core.model.SignalScores;
import com.catalog.matching.core.model.TrainingExample;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tier 1: the line item was approved before, practically verbatim. Ordered by manual weight,
 * then by most recent approval. Every score is reported as 1.0.
 */
public class ExactTrainingTier implements MatchTier {

    static final String NAME = "training_exact";

    private static final Comparator<TrainingMatch> ORDER =
            Comparator.comparingDouble((TrainingMatch m) -> m.example().getWeight()).reversed()
                    .thenComparing(m -> m.example().getApprovedAt(), Comparator.reverseOrder())
                    .thenComparing(Comparator.comparingDouble(TrainingMatch::similarity).reversed())
                    .thenComparing(m -> m.product().name())
                    .thenComparing(m -> m.example().getId());

    private final double exactThreshold;

    public ExactTrainingTier(double exactThreshold) {
        this.exactThreshold = exactThreshold;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<MatchCandidate> evaluate(MatchContext context) {
        Set<String> seenProducts = new LinkedHashSet<>();
        return context.trainingMatches().stream()
                .filter(m -> m.similarity() >= exactThreshold)
                .sorted(ORDER)
                .filter(m -> seenProducts.add(m.product().id()))
                .limit(context.limit())
                .map(this::toCandidate)
                .collect(Collectors.toList());
    }

    private MatchCandidate toCandidate(TrainingMatch match) {
        TrainingExample example = match.example();
        String reasoning = String.format(Locale.ROOT,
                "Exact training match: approved %s as %s (similarity %.2f, weight %.2f)",
                example.getApprovedAt(), example.getQuality().name().toLowerCase(Locale.ROOT),
                match.similarity(), example.getWeight());
        return new MatchCandidate(match.product(), SignalScores.uniform(1.0), 1.0,
                MatchSource.TRAINING_EXACT, reasoning, example.getId());
    }
}
