package com.catalog.matching.retrieval;

import com.catalog.matching.api.MatchOptions;
import com.catalog.matching.core.model.Alias;
import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.TrainingExample;
import com.catalog.matching.signal.AliasMatcher;
import com.catalog.matching.signal.ProductTextIndex;
import com.catalog.matching.signal.QueryContext;
import com.catalog.matching.signal.TrainingSimilarity;
import com.catalog.matching.similarity.BlockingKeyStrategy;
import com.catalog.matching.similarity.LevenshteinSimilarity;
import com.catalog.matching.similarity.TrigramSimilarity;
import com.catalog.matching.store.AliasStore;
import com.catalog.matching.store.CatalogStore;
import com.catalog.matching.store.CatalogUnavailableException;
import com.catalog.matching.store.TrainingDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Candidate retrieval by cheap trigram pre-filter.
 *
 * <p>Small catalogs are scanned in full; larger ones are first narrowed through blocking keys.
 * Survivors of the floor are kept in descending cheap-score order up to {@code maxCandidates}.
 * Products with a qualifying alias or a similar recent approval are always added on top, so
 * feedback can surface products whose catalog text looks nothing like the line item.</p>
 */
public class TrigramCandidateRetriever implements CandidateRetriever {
    private static final Logger log = LoggerFactory.getLogger(TrigramCandidateRetriever.class);

    private final CatalogStore catalogStore;
    private final AliasStore aliasStore;
    private final TrainingDataStore trainingStore;
    private final ProductTextIndex textIndex;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final AliasMatcher aliasMatcher;
    private final TrainingSimilarity trainingSimilarity;
    private final MatchOptions options;
    private final TrigramSimilarity trigram = new TrigramSimilarity();
    private final LevenshteinSimilarity levenshtein;

    public TrigramCandidateRetriever(CatalogStore catalogStore,
                                     AliasStore aliasStore,
                                     TrainingDataStore trainingStore,
                                     ProductTextIndex textIndex,
                                     BlockingKeyStrategy blockingKeyStrategy,
                                     AliasMatcher aliasMatcher,
                                     TrainingSimilarity trainingSimilarity,
                                     MatchOptions options) {
        this.catalogStore = catalogStore;
        this.aliasStore = aliasStore;
        this.trainingStore = trainingStore;
        this.textIndex = textIndex;
        this.blockingKeyStrategy = blockingKeyStrategy;
        this.aliasMatcher = aliasMatcher;
        this.trainingSimilarity = trainingSimilarity;
        this.options = options;
        this.levenshtein = new LevenshteinSimilarity(options.getFuzzyMaxDistance());
    }

    @Override
    public List<Product> retrieve(QueryContext query, RetrievalMode mode) {
        if (query.normalizedText().isEmpty()) {
            return List.of();
        }
        CatalogScope scope = query.scope();

        List<Product> pool = catalogStore.count(scope) <= options.getFullScanLimit()
                ? catalogStore.findAll(scope)
                : catalogStore.findByBlockingKeys(scope, blockingKeyStrategy.generateKeys(query.normalizedText()));

        List<Scored> survivors = new ArrayList<>();
        for (Product product : pool) {
            double cheap = cheapScore(query, product, mode);
            if (passesFloor(cheap, mode)) {
                survivors.add(new Scored(product, cheap));
            }
        }
        survivors.sort(Comparator.comparingDouble(Scored::score).reversed()
                .thenComparing(s -> s.product().name())
                .thenComparing(s -> s.product().sku(), Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(s -> s.product().id()));

        Map<String, Product> candidates = new LinkedHashMap<>();
        for (Scored s : survivors) {
            if (candidates.size() >= options.getMaxCandidates()) {
                break;
            }
            candidates.put(s.product().id(), s.product());
        }

        for (String productId : feedbackProductIds(query)) {
            if (!candidates.containsKey(productId)) {
                catalogStore.findById(scope, productId).ifPresent(p -> candidates.put(p.id(), p));
            }
        }

        log.debug("retrieval.completed mode={} pool={} survivors={} candidates={}",
                mode, pool.size(), survivors.size(), candidates.size());
        return new ArrayList<>(candidates.values());
    }

    private double cheapScore(QueryContext query, Product product, RetrievalMode mode) {
        double best = 0.0;
        for (String field : textIndex.texts(product).fields()) {
            best = Math.max(best, trigram.compute(query.normalizedText(), field));
            if (mode == RetrievalMode.RELAXED) {
                best = Math.max(best, levenshtein.compute(query.normalizedText(), field));
            }
        }
        return best;
    }

    private boolean passesFloor(double cheap, RetrievalMode mode) {
        if (mode == RetrievalMode.STRICT) {
            return cheap >= options.getRetrievalFloor();
        }
        return cheap > options.getFallbackFloor();
    }

    /**
     * Products reachable through aliases or recent approvals. Failures here shrink the
     * candidate set but never fail retrieval.
     */
    private Set<String> feedbackProductIds(QueryContext query) {
        Set<String> ids = new LinkedHashSet<>();
        try {
            for (Alias alias : aliasStore.findAll(query.scope())) {
                if (aliasMatcher.score(query, alias) > 0.0) {
                    ids.add(alias.getProductId());
                }
            }
        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("retrieval.alias_lookup_failed scope={} error={}", query.scope(), e.toString());
        }

        try {
            for (TrainingExample example : trainingStore.findTrainable(query.scope(),
                    query.now().minus(options.getLearnedWindow()))) {
                if (trainingSimilarity.compute(query, example) >= options.getLearnedMinSimilarity()) {
                    ids.add(example.getProductId());
                }
            }
        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("retrieval.training_lookup_failed scope={} error={}", query.scope(), e.toString());
        }
        return ids;
    }

    private record Scored(Product product, double score) {}
}
