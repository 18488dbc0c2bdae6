package com.catalog.matching.tier;

import com.catalog.matching.api.MatchOptions;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalType;
import com.catalog.matching.core.model.TrainingExample;
import com.catalog.matching.metrics.MetricsService;
import com.catalog.matching.signal.QueryContext;
import com.catalog.matching.signal.TrainingSimilarity;
import com.catalog.matching.store.CatalogStore;
import com.catalog.matching.store.CatalogUnavailableException;
import com.catalog.matching.store.TrainingDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds approved examples of any quality or age whose similarity to the query clears the
 * pre-filter. Examples pointing at products no longer in the catalog are
 * skipped. A failing training store yields no matches.
 */
public class TrainingMatchFinder {
    private static final Logger log = LoggerFactory.getLogger(TrainingMatchFinder.class);

    private final TrainingDataStore trainingStore;
    private final CatalogStore catalogStore;
    private final TrainingSimilarity trainingSimilarity;
    private final MatchOptions options;
    private final MetricsService metricsService;

    public TrainingMatchFinder(TrainingDataStore trainingStore, CatalogStore catalogStore,
                               TrainingSimilarity trainingSimilarity, MatchOptions options,
                               MetricsService metricsService) {
        this.trainingStore = trainingStore;
        this.catalogStore = catalogStore;
        this.trainingSimilarity = trainingSimilarity;
        this.options = options;
        this.metricsService = metricsService;
    }

    public List<TrainingMatch> find(QueryContext query) {
        if (query.normalizedText().isEmpty()) {
            return List.of();
        }

        List<TrainingExample> examples;
        try {
            examples = trainingStore.findAll(query.scope());
        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("training.lookup_failed scope={} error={}", query.scope(), e.toString());
            metricsService.incrementSignalFailure(SignalType.LEARNED);
            return List.of();
        }

        List<TrainingMatch> matches = new ArrayList<>();
        for (TrainingExample example : examples) {
            double similarity = trainingSimilarity.compute(query, example);
            if (similarity <= options.getTrainingPrefilter()) {
                continue;
            }
            Optional<Product> product = catalogStore.findById(query.scope(), example.getProductId());
            if (product.isEmpty()) {
                log.debug("Skipping training example {} for missing product {}", example.getId(), example.getProductId());
                continue;
            }
            matches.add(new TrainingMatch(example, product.get(), similarity));
        }
        return matches;
    }
}
