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
 * Tier 2: close to a previously approved line item. Similarity s in [good, exact) maps
 * linearly onto a final score in [0.85, 0.95).
 */
public class HighConfidenceTrainingTier implements MatchTier {

    static final String NAME = "training_good";
    static final double BASE_SCORE = 0.85;
    static final double SCORE_SPAN = 0.10;

    private static final Comparator<TrainingMatch> ORDER =
            Comparator.comparingDouble(TrainingMatch::similarity).reversed()
                    .thenComparing(Comparator.comparingDouble((TrainingMatch m) -> m.example().getWeight()).reversed())
                    .thenComparing(m -> m.example().getApprovedAt(), Comparator.reverseOrder())
                    .thenComparing(m -> m.product().name())
                    .thenComparing(m -> m.example().getId());

    private final double goodThreshold;
    private final double exactThreshold;

    public HighConfidenceTrainingTier(double goodThreshold, double exactThreshold) {
        if (goodThreshold > exactThreshold) {
            throw new IllegalArgumentException("goodThreshold must be <= exactThreshold");
        }
        this.goodThreshold = goodThreshold;
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
                .filter(m -> m.similarity() >= goodThreshold && m.similarity() < exactThreshold)
                .sorted(ORDER)
                .filter(m -> seenProducts.add(m.product().id()))
                .limit(context.limit())
                .map(this::toCandidate)
                .collect(Collectors.toList());
    }

    double finalScore(double similarity) {
        double span = exactThreshold - goodThreshold;
        if (span <= 0.0) {
            return BASE_SCORE;
        }
        double score = BASE_SCORE + (similarity - goodThreshold) * SCORE_SPAN / span;
        return Math.max(BASE_SCORE, Math.min(BASE_SCORE + SCORE_SPAN, score));
    }

    private MatchCandidate toCandidate(TrainingMatch match) {
        TrainingExample example = match.example();
        double s = match.similarity();
        String reasoning = String.format(Locale.ROOT,
                "Similar to approved line item \"%s\" (similarity %.2f, %s)",
                example.getLineItemText(), s, example.getQuality().name().toLowerCase(Locale.ROOT));
        return new MatchCandidate(match.product(), new SignalScores(0.0, s, s, 0.0, s), finalScore(s),
                MatchSource.TRAINING_GOOD, reasoning, example.getId());
    }
}
