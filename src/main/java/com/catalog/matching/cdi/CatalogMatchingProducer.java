package com.catalog.matching.cdi;

import com.catalog.matching.api.MatchOptions;
import com.catalog.matching.api.ProductMatcher;
import com.catalog.matching.cache.CacheConfig;
import com.catalog.matching.cache.CaffeineMatchCache;
import com.catalog.matching.cache.MatchCache;
import com.catalog.matching.cache.NoOpMatchCache;
import com.catalog.matching.embedding.EmbeddingProvider;
import com.catalog.matching.embedding.HttpEmbeddingProvider;
import com.catalog.matching.embedding.NoOpEmbeddingProvider;
import com.catalog.matching.lock.LocalDistributedLock;
import com.catalog.matching.lock.LockConfig;
import com.catalog.matching.metrics.MetricsService;
import com.catalog.matching.metrics.MicrometerMetricsService;
import com.catalog.matching.metrics.NoOpMetricsService;
import com.catalog.matching.rules.DefaultNormalizationRules;
import com.catalog.matching.rules.NormalizationEngine;
import com.catalog.matching.similarity.SignalWeights;
import com.catalog.matching.similarity.TokenBlockingKeyStrategy;
import com.catalog.matching.store.CatalogStore;
import com.catalog.matching.store.InMemoryCatalogStore;
import com.catalog.matching.tracing.NoOpTracingService;
import com.catalog.matching.tracing.OpenTelemetryTracingService;
import com.catalog.matching.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the catalog matcher from MicroProfile Config properties.
 *
 * <p>Defaults live in {@code META-INF/microprofile-config.properties}. Every threshold and
 * weight reaches the engine through the produced {@link MatchOptions}.</p>
 *
 * <pre>
 * catalog-matching.threshold.default=0.3
 * catalog-matching.weights.trigram=0.40
 * catalog-matching.embedding.api-key=...
 * </pre>
 *
 * <p>The produced catalog is in memory; deployments backed by a database supply their own
 * {@link CatalogStore} as a CDI alternative.</p>
 */
@ApplicationScoped
public class CatalogMatchingProducer {

    private static final Logger log = LoggerFactory.getLogger(CatalogMatchingProducer.class);

    // ── Thresholds ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-matching.limit.default", defaultValue = "10")
    int defaultLimit;

    @Inject
    @ConfigProperty(name = "catalog-matching.threshold.default", defaultValue = "0.3")
    double defaultThreshold;

    @Inject
    @ConfigProperty(name = "catalog-matching.training.exact-threshold", defaultValue = "0.95")
    double exactTrainingThreshold;

    @Inject
    @ConfigProperty(name = "catalog-matching.training.good-threshold", defaultValue = "0.80")
    double goodTrainingThreshold;

    @Inject
    @ConfigProperty(name = "catalog-matching.training.learned-window-days", defaultValue = "180")
    int learnedWindowDays;

    // ── Signal Weights ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-matching.weights.trigram", defaultValue = "0.40")
    double trigramWeight;

    @Inject
    @ConfigProperty(name = "catalog-matching.weights.fuzzy", defaultValue = "0.25")
    double fuzzyWeight;

    @Inject
    @ConfigProperty(name = "catalog-matching.weights.alias", defaultValue = "0.20")
    double aliasWeight;

    @Inject
    @ConfigProperty(name = "catalog-matching.weights.learned", defaultValue = "0.10")
    double learnedWeight;

    @Inject
    @ConfigProperty(name = "catalog-matching.weights.vector", defaultValue = "0.05")
    double vectorWeight;

    // ── Retrieval ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-matching.retrieval.max-candidates", defaultValue = "200")
    int maxCandidates;

    @Inject
    @ConfigProperty(name = "catalog-matching.retrieval.floor", defaultValue = "0.12")
    double retrievalFloor;

    @Inject
    @ConfigProperty(name = "catalog-matching.retrieval.fallback-floor", defaultValue = "0.10")
    double fallbackFloor;

    // ── Batch ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-matching.batch.parallelism", defaultValue = "4")
    int batchParallelism;

    @Inject
    @ConfigProperty(name = "catalog-matching.batch.query-timeout-seconds", defaultValue = "30")
    int queryTimeoutSeconds;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-matching.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "catalog-matching.cache.max-size", defaultValue = "50000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "catalog-matching.cache.ttl-seconds", defaultValue = "14400")
    int cacheTtlSeconds;

    // ── Locks ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-matching.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    // ── Embeddings ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-matching.embedding.base-url", defaultValue = "https://api.openai.com")
    String embeddingBaseUrl;

    @Inject
    @ConfigProperty(name = "catalog-matching.embedding.model", defaultValue = "text-embedding-3-small")
    String embeddingModel;

    @Inject
    @ConfigProperty(name = "catalog-matching.embedding.api-key")
    Optional<String> embeddingApiKey;

    @Inject
    @ConfigProperty(name = "catalog-matching.embedding.timeout-seconds", defaultValue = "10")
    int embeddingTimeoutSeconds;

    // ── Observability ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-matching.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public NormalizationEngine normalizationEngine() {
        return DefaultNormalizationRules.createDefaultEngine();
    }

    @Produces
    @ApplicationScoped
    public CatalogStore catalogStore(NormalizationEngine normalizer) {
        return new InMemoryCatalogStore(normalizer, new TokenBlockingKeyStrategy());
    }

    @Produces
    @ApplicationScoped
    public MatchOptions matchOptions() {
        MatchOptions options = MatchOptions.builder()
                .defaultLimit(defaultLimit)
                .defaultThreshold(defaultThreshold)
                .exactTrainingThreshold(exactTrainingThreshold)
                .goodTrainingThreshold(goodTrainingThreshold)
                .learnedWindow(Duration.ofDays(learnedWindowDays))
                .signalWeights(new SignalWeights(trigramWeight, fuzzyWeight, aliasWeight, learnedWeight, vectorWeight))
                .maxCandidates(maxCandidates)
                .retrievalFloor(retrievalFloor)
                .fallbackFloor(fallbackFloor)
                .batchParallelism(batchParallelism)
                .queryTimeout(Duration.ofSeconds(queryTimeoutSeconds))
                .build();
        log.info("Match options: {}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public ProductMatcher productMatcher(CatalogStore catalogStore, NormalizationEngine normalizer,
                                        MatchOptions options) {
        log.info("Producing ProductMatcher: cache={} tracing={} embeddings={}",
                cacheEnabled, tracingEnabled, embeddingApiKey.isPresent());
        return ProductMatcher.builder()
                .catalogStore(catalogStore)
                .normalizationEngine(normalizer)
                .options(options)
                .cache(createCache())
                .distributedLock(new LocalDistributedLock(new LockConfig(lockTimeoutMs)))
                .embeddingProvider(createEmbeddingProvider())
                .metricsService(createMetricsService())
                .tracingService(createTracingService())
                .build();
    }

    public void closeMatcher(@Disposes ProductMatcher matcher) {
        log.info("Closing ProductMatcher");
        matcher.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private MatchCache createCache() {
        if (!cacheEnabled) {
            return new NoOpMatchCache();
        }
        return new CaffeineMatchCache(new CacheConfig(cacheMaxSize, cacheTtlSeconds, true));
    }

    private EmbeddingProvider createEmbeddingProvider() {
        if (embeddingApiKey.isEmpty() || embeddingApiKey.get().isBlank()) {
            log.info("No embedding API key configured; vector signal disabled");
            return new NoOpEmbeddingProvider();
        }
        return HttpEmbeddingProvider.builder()
                .baseUrl(embeddingBaseUrl)
                .apiKey(embeddingApiKey.get())
                .model(embeddingModel)
                .timeout(Duration.ofSeconds(embeddingTimeoutSeconds))
                .build();
    }

    private MetricsService createMetricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }

    private TracingService createTracingService() {
        if (!tracingEnabled) {
            return new NoOpTracingService();
        }
        return new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer("catalog-matching"));
    }
}
