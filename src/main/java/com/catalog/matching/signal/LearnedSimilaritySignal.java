package com.catalog.matching.signal;

import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalType;
import com.catalog.matching.core.model.TrainingExample;
import com.catalog.matching.rules.DimensionSpec;
import com.catalog.matching.store.TrainingDataStore;
import com.catalog.matching.training.TrainingDecayModel;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Evidence from past approvals of this product for similar text.
 *
 * <p>Each recent example of trainable quality whose text similarity reaches the minimum is
 * weighted by a dimension bonus, its quality, its confidence, its age and its manual weight.
 * The best and mean weights are blended 80/20 and scaled by how many examples agree, then
 * capped at {@value #MAX_SCORE} so learned evidence alone never outranks a training-tier hit.</p>
 */
public class LearnedSimilaritySignal implements ProductSignal {

    static final double MAX_SCORE = 0.95;
    static final double THREAD_BONUS = 0.3;
    static final double LENGTH_BONUS = 0.2;
    static final double HIGH_CONFIDENCE = 0.8;
    static final double HIGH_CONFIDENCE_BOOST = 1.1;
    static final int MIN_QUERY_LENGTH = 3;

    private final TrainingDataStore trainingStore;
    private final TrainingSimilarity trainingSimilarity;
    private final TrainingDecayModel decayModel;
    private final LearnedSettings settings;

    public LearnedSimilaritySignal(TrainingDataStore trainingStore, TrainingSimilarity trainingSimilarity,
                                   TrainingDecayModel decayModel, LearnedSettings settings) {
        this.trainingStore = trainingStore;
        this.trainingSimilarity = trainingSimilarity;
        this.decayModel = decayModel;
        this.settings = settings;
    }

    @Override
    public SignalType type() {
        return SignalType.LEARNED;
    }

    @Override
    public double score(QueryContext query, Product product) {
        if (query.rawText() == null || query.rawText().trim().length() < MIN_QUERY_LENGTH) {
            return 0.0;
        }

        Instant since = query.now().minus(settings.window());
        List<TrainingExample> examples = trainingStore.findByProduct(query.scope(), product.id()).stream()
                .filter(e -> e.getQuality().isTrainable())
                .filter(e -> !e.getApprovedAt().isBefore(since))
                .sorted(Comparator.comparingDouble(TrainingExample::getConfidence).reversed()
                        .thenComparing(TrainingExample::getApprovedAt, Comparator.reverseOrder()))
                .limit(settings.maxExamples())
                .collect(Collectors.toList());

        double best = 0.0;
        double sum = 0.0;
        int count = 0;
        for (TrainingExample example : examples) {
            double similarity = trainingSimilarity.compute(query, example);
            if (similarity < settings.minSimilarity()) {
                continue;
            }
            double weighted = weigh(query, example, similarity);
            best = Math.max(best, weighted);
            sum += weighted;
            count++;
        }
        if (count == 0) {
            return 0.0;
        }

        double blended = (best * 0.8 + (sum / count) * 0.2) * decayModel.evidenceFactor(count);
        return Math.max(0.0, Math.min(MAX_SCORE, blended));
    }

    private double weigh(QueryContext query, TrainingExample example, double similarity) {
        DimensionSpec exampleDims = DimensionSpec.extract(example.getLineItemText());
        double bonus = 0.0;
        if (query.dimensions().sameThread(exampleDims)) {
            bonus += THREAD_BONUS;
        }
        if (query.dimensions().sameLength(exampleDims)) {
            bonus += LENGTH_BONUS;
        }

        double weighted = (similarity + bonus) * example.getQuality().learnedMultiplier();
        if (example.getConfidence() > HIGH_CONFIDENCE) {
            weighted *= HIGH_CONFIDENCE_BOOST;
        }
        weighted *= decayModel.recencyFactor(example, query.now());
        return weighted * example.getWeight();
    }

    /**
     * @param window        how far back approvals count
     * @param minSimilarity text similarity an example needs to contribute
     * @param maxExamples   examples considered per product
     */
    public record LearnedSettings(Duration window, double minSimilarity, int maxExamples) {}
}
