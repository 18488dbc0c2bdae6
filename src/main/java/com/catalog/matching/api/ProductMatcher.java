package com.catalog.matching.api;

import com.catalog.matching.audit.AuditRepository;
import com.catalog.matching.audit.AuditService;
import com.catalog.matching.cache.MatchCache;
import com.catalog.matching.cache.MatchCacheKey;
import com.catalog.matching.cache.NoOpMatchCache;
import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.TrainingExample;
import com.catalog.matching.embedding.EmbeddingProvider;
import com.catalog.matching.embedding.NoOpEmbeddingProvider;
import com.catalog.matching.lock.DistributedLock;
import com.catalog.matching.lock.LocalDistributedLock;
import com.catalog.matching.metrics.MetricsService;
import com.catalog.matching.metrics.NoOpMetricsService;
import com.catalog.matching.retrieval.CandidateRetriever;
import com.catalog.matching.retrieval.TrigramCandidateRetriever;
import com.catalog.matching.rules.DefaultNormalizationRules;
import com.catalog.matching.rules.NormalizationEngine;
import com.catalog.matching.signal.AliasMatcher;
import com.catalog.matching.signal.AliasSignal;
import com.catalog.matching.signal.FuzzySignal;
import com.catalog.matching.signal.LearnedSimilaritySignal;
import com.catalog.matching.signal.ProductTextIndex;
import com.catalog.matching.signal.SignalEvaluator;
import com.catalog.matching.signal.TrainingSimilarity;
import com.catalog.matching.signal.TrigramSignal;
import com.catalog.matching.signal.VectorSignal;
import com.catalog.matching.similarity.BlockingKeyStrategy;
import com.catalog.matching.similarity.TokenBlockingKeyStrategy;
import com.catalog.matching.store.AliasStore;
import com.catalog.matching.store.CatalogStore;
import com.catalog.matching.store.CatalogUnavailableException;
import com.catalog.matching.store.InMemoryAliasStore;
import com.catalog.matching.store.InMemoryTrainingDataStore;
import com.catalog.matching.store.TrainingDataStore;
import com.catalog.matching.tier.AlgorithmicTier;
import com.catalog.matching.tier.CandidateScorer;
import com.catalog.matching.tier.ExactTrainingTier;
import com.catalog.matching.tier.FallbackTier;
import com.catalog.matching.tier.HighConfidenceTrainingTier;
import com.catalog.matching.tier.MatchTier;
import com.catalog.matching.tier.TieredMatchOrchestrator;
import com.catalog.matching.tier.TrainingMatchFinder;
import com.catalog.matching.tracing.NoOpTracingService;
import com.catalog.matching.tracing.TracingService;
import com.catalog.matching.training.ApprovalAck;
import com.catalog.matching.training.ApprovalRequest;
import com.catalog.matching.training.CsvTrainingImporter;
import com.catalog.matching.training.ImportResult;
import com.catalog.matching.training.TrainingDecayModel;
import com.catalog.matching.training.TrainingFeedbackRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point for catalog matching.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ProductMatcher matcher = ProductMatcher.builder()
 *     .catalogStore(catalog)
 *     .build();
 *
 * CatalogScope scope = CatalogScope.of("acme");
 * List&lt;MatchCandidate&gt; candidates = matcher.match(scope, "hex bolt 1/4-20 x 1 ss");
 *
 * // Approved matches answer the same text first next time
 * matcher.recordApproval(ApprovalRequest.of(scope, "hex bolt 1/4-20 x 1 ss",
 *         candidates.get(0).productId(), MatchQuality.EXCELLENT));
 * </pre>
 */
public class ProductMatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProductMatcher.class);

    private final CatalogStore catalogStore;
    private final AliasStore aliasStore;
    private final TrainingDataStore trainingStore;
    private final NormalizationEngine normalizer;
    private final MatchOptions options;
    private final MatchCache cache;
    private final MetricsService metricsService;
    private final AuditService auditService;
    private final TieredMatchOrchestrator orchestrator;
    private final TrainingFeedbackRecorder recorder;
    private final CsvTrainingImporter importer;
    private final BatchMatcher batchMatcher;

    private ProductMatcher(Builder builder) {
        this.catalogStore = builder.catalogStore;
        this.aliasStore = builder.aliasStore != null ? builder.aliasStore : new InMemoryAliasStore();
        this.trainingStore = builder.trainingStore != null ? builder.trainingStore : new InMemoryTrainingDataStore();
        this.normalizer = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        this.options = builder.options;
        this.cache = builder.cache != null ? builder.cache : new NoOpMatchCache();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        EmbeddingProvider embeddingProvider = builder.embeddingProvider != null
                ? builder.embeddingProvider : new NoOpEmbeddingProvider();
        BlockingKeyStrategy blockingKeyStrategy = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy : new TokenBlockingKeyStrategy();
        DistributedLock lock = builder.distributedLock != null ? builder.distributedLock : new LocalDistributedLock();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else {
            this.auditService = new AuditService();
        }

        // Signals
        ProductTextIndex textIndex = new ProductTextIndex(normalizer);
        TrainingSimilarity trainingSimilarity = new TrainingSimilarity(normalizer);
        AliasMatcher aliasMatcher = new AliasMatcher(normalizer, options.getAliasFloor());
        SignalEvaluator evaluator = new SignalEvaluator(List.of(
                new VectorSignal(catalogStore),
                new TrigramSignal(textIndex),
                new FuzzySignal(textIndex, options.getFuzzyMaxDistance()),
                new AliasSignal(aliasStore, aliasMatcher),
                new LearnedSimilaritySignal(trainingStore, trainingSimilarity, new TrainingDecayModel(),
                        new LearnedSimilaritySignal.LearnedSettings(options.getLearnedWindow(),
                                options.getLearnedMinSimilarity(), options.getLearnedMaxExamples()))
        ), metricsService);

        // Tiers, in priority order
        CandidateRetriever retriever = new TrigramCandidateRetriever(catalogStore, aliasStore, trainingStore,
                textIndex, blockingKeyStrategy, aliasMatcher, trainingSimilarity, options);
        CandidateScorer scorer = new CandidateScorer(evaluator, options.getSignalWeights());
        List<MatchTier> tiers = List.of(
                new ExactTrainingTier(options.getExactTrainingThreshold()),
                new HighConfidenceTrainingTier(options.getGoodTrainingThreshold(), options.getExactTrainingThreshold()),
                new AlgorithmicTier(retriever, scorer),
                new FallbackTier(retriever, scorer));

        this.recorder = new TrainingFeedbackRecorder(trainingStore, aliasStore, catalogStore, normalizer,
                lock, cache, auditService, metricsService, options, clock);
        TrainingMatchFinder trainingMatchFinder = new TrainingMatchFinder(trainingStore, catalogStore,
                trainingSimilarity, options, metricsService);
        this.orchestrator = new TieredMatchOrchestrator(tiers, trainingMatchFinder, normalizer, embeddingProvider,
                options, clock, metricsService, tracingService, recorder);
        this.importer = new CsvTrainingImporter(recorder, catalogStore, normalizer, auditService);
        this.batchMatcher = new BatchMatcher(this::match, options, metricsService);

        log.info("ProductMatcher initialized with options: {}", options);
    }

    // ========== Matching API ==========

    /**
     * Matches a line item with the default limit and threshold.
     *
     * @throws CatalogUnavailableException if the catalog cannot be read
     */
    public List<MatchCandidate> match(CatalogScope scope, String text) {
        return match(scope, MatchQuery.of(text));
    }

    public List<MatchCandidate> match(CatalogScope scope, String text, Integer limit, Double threshold) {
        return match(scope, new MatchQuery(text, limit, threshold));
    }

    /**
     * Matches a line item, serving repeated queries from the cache while the scope's catalog,
     * aliases and training data are unchanged.
     *
     * @throws CatalogUnavailableException if the catalog cannot be read
     */
    public List<MatchCandidate> match(CatalogScope scope, MatchQuery query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        Optional<MatchCacheKey> key = cacheKey(scope, query);
        if (key.isPresent()) {
            Optional<List<MatchCandidate>> cached = cache.get(key.get());
            if (cached.isPresent()) {
                metricsService.recordCacheHit();
                return cached.get();
            }
            metricsService.recordCacheMiss();
        }

        List<MatchCandidate> results = orchestrator.match(scope, query);
        key.ifPresent(k -> cache.put(k, results));
        return results;
    }

    /**
     * Matches several line items concurrently. Item {@code i} answers {@code texts.get(i)}.
     *
     * @throws CatalogUnavailableException if the catalog cannot be read
     */
    public List<BatchMatchItem> matchBatch(CatalogScope scope, List<String> texts, Integer limit, Double threshold) {
        return batchMatcher.matchAll(scope, texts, limit, threshold);
    }

    // ========== Training API ==========

    public ApprovalAck recordApproval(ApprovalRequest request) {
        return recorder.recordApproval(request);
    }

    public ImportResult importTraining(CatalogScope scope, Reader csv, String importedBy) {
        return importer.importCsv(scope, csv, importedBy);
    }

    public List<TrainingExample> getTrainingExamples(CatalogScope scope, String productId) {
        return trainingStore.findByProduct(scope, productId);
    }

    public Optional<TrainingExample> updateTrainingWeight(CatalogScope scope, String exampleId, double weight,
                                                          String updatedBy) {
        return recorder.updateWeight(scope, exampleId, weight, updatedBy);
    }

    // ========== Internals ==========

    private Optional<MatchCacheKey> cacheKey(CatalogScope scope, MatchQuery query) {
        String normalized = normalizer.normalize(query.text());
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        long snapshot = catalogStore.version(scope);
        try {
            snapshot += aliasStore.version(scope) + trainingStore.version(scope);
        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Store version unavailable, bypassing cache: {}", e.toString());
            return Optional.empty();
        }
        return Optional.of(new MatchCacheKey(scope, normalized,
                options.effectiveLimit(query.limit()), options.effectiveThreshold(query.threshold()), snapshot));
    }

    @Override
    public void close() {
        batchMatcher.close();
        log.info("ProductMatcher closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CatalogStore catalogStore;
        private AliasStore aliasStore;
        private TrainingDataStore trainingStore;
        private NormalizationEngine normalizationEngine;
        private BlockingKeyStrategy blockingKeyStrategy;
        private EmbeddingProvider embeddingProvider;
        private MatchOptions options = MatchOptions.defaults();
        private MatchCache cache;
        private DistributedLock distributedLock;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;

        /**
         * Sets the product catalog. Required.
         */
        public Builder catalogStore(CatalogStore catalogStore) {
            this.catalogStore = catalogStore;
            return this;
        }

        /**
         * Defaults to {@link InMemoryAliasStore} if not set.
         */
        public Builder aliasStore(AliasStore aliasStore) {
            this.aliasStore = aliasStore;
            return this;
        }

        /**
         * Defaults to {@link InMemoryTrainingDataStore} if not set.
         */
        public Builder trainingStore(TrainingDataStore trainingStore) {
            this.trainingStore = trainingStore;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine engine) {
            this.normalizationEngine = engine;
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        /**
         * Sets the query embedding provider. Without one the vector signal scores 0.
         */
        public Builder embeddingProvider(EmbeddingProvider embeddingProvider) {
            this.embeddingProvider = embeddingProvider;
            return this;
        }

        public Builder options(MatchOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the result cache. Defaults to {@link NoOpMatchCache} if not set.
         */
        public Builder cache(MatchCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder distributedLock(DistributedLock lock) {
            this.distributedLock = lock;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Clock for approval timestamps and training decay. Defaults to UTC system time.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ProductMatcher build() {
            if (catalogStore == null) {
                throw new IllegalStateException("CatalogStore is required");
            }
            if (options == null) {
                throw new IllegalStateException("MatchOptions is required");
            }
            return new ProductMatcher(this);
        }
    }
}
