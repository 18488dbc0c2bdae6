package com.catalog.matching.tier;

import com.catalog.matching.api.MatchOptions;
import com.catalog.matching.api.MatchQuery;
import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.SignalType;
import com.catalog.matching.embedding.EmbeddingProvider;
import com.catalog.matching.logging.LogContext;
import com.catalog.matching.metrics.MetricsService;
import com.catalog.matching.rules.NormalizationEngine;
import com.catalog.matching.signal.QueryContext;
import com.catalog.matching.tracing.Span;
import com.catalog.matching.tracing.TracingService;
import com.catalog.matching.training.TrainingReferenceListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs the match tiers in order and returns the first non-empty answer.
 *
 * <p>Input is validated once: blank text yields no results, the limit is clamped to [1, 100]
 * and the threshold to [0, 1]. Signal and training-store failures degrade inside the tiers;
 * a {@link com.catalog.matching.store.CatalogUnavailableException} propagates to the caller.</p>
 */
public class TieredMatchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(TieredMatchOrchestrator.class);

    static final String NO_MATCH = "none";

    private final List<MatchTier> tiers;
    private final TrainingMatchFinder trainingMatchFinder;
    private final NormalizationEngine normalizer;
    private final EmbeddingProvider embeddingProvider;
    private final MatchOptions options;
    private final Clock clock;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final TrainingReferenceListener referenceListener;

    public TieredMatchOrchestrator(List<MatchTier> tiers,
                                   TrainingMatchFinder trainingMatchFinder,
                                   NormalizationEngine normalizer,
                                   EmbeddingProvider embeddingProvider,
                                   MatchOptions options,
                                   Clock clock,
                                   MetricsService metricsService,
                                   TracingService tracingService,
                                   TrainingReferenceListener referenceListener) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("at least one tier is required");
        }
        this.tiers = List.copyOf(tiers);
        this.trainingMatchFinder = Objects.requireNonNull(trainingMatchFinder, "trainingMatchFinder is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
        this.referenceListener = referenceListener != null ? referenceListener : TrainingReferenceListener.NONE;
    }

    /**
     * Matches one line item. Never returns null.
     */
    public List<MatchCandidate> match(CatalogScope scope, MatchQuery query) {
        Objects.requireNonNull(scope, "scope is required");
        if (query == null || query.isBlank()) {
            return List.of();
        }

        int limit = options.effectiveLimit(query.limit());
        double threshold = options.effectiveThreshold(query.threshold());
        String text = query.text();
        QueryContext queryContext = QueryContext.create(scope, text, normalizer, clock.instant(),
                () -> embedQuery(text));
        if (queryContext.normalizedText().isEmpty()) {
            log.debug("Query '{}' normalizes to empty text; nothing to match", text);
            return List.of();
        }
        MatchContext context = new MatchContext(queryContext, limit, threshold, trainingMatchFinder::find);

        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forMatch(LogContext.generateCorrelationId(), scope.tenantId());
             Span span = tracingService.startMatchSpan("catalog.match", scope)) {
            span.setAttribute("limit", limit);
            span.setAttribute("threshold", threshold);
            try {
                for (MatchTier tier : tiers) {
                    List<MatchCandidate> results = evaluateTier(tier, context);
                    if (!results.isEmpty()) {
                        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                        recordHit(tier.name(), results, elapsed, span);
                        log.info("match.completed tier={} results={} topScore={} elapsedMs={}",
                                tier.name(), results.size(), results.get(0).finalScore(), elapsed.toMillis());
                        notifyReferenced(scope, results);
                        return List.copyOf(results);
                    }
                    span.addEvent(tier.name() + ".empty");
                    log.debug("Tier {} produced no candidates for '{}'", tier.name(), queryContext.normalizedText());
                }
                metricsService.recordMatchDuration(NO_MATCH, Duration.ofNanos(System.nanoTime() - start));
                span.setAttribute("tier", NO_MATCH);
                span.setStatus(Span.SpanStatus.OK);
                log.info("match.completed tier={} results=0", NO_MATCH);
                return List.of();
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    private List<MatchCandidate> evaluateTier(MatchTier tier, MatchContext context) {
        try (Span tierSpan = tracingService.startSpan("catalog.match.tier", Map.of("tier", tier.name()))) {
            try {
                List<MatchCandidate> results = tier.evaluate(context);
                metricsService.recordCandidateCount(results.size());
                tierSpan.setAttribute("results", results.size());
                tierSpan.setStatus(Span.SpanStatus.OK);
                return results;
            } catch (RuntimeException e) {
                tierSpan.recordException(e);
                tierSpan.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    private void recordHit(String tier, List<MatchCandidate> results, Duration elapsed, Span span) {
        metricsService.incrementTierHit(tier);
        metricsService.recordMatchDuration(tier, elapsed);
        metricsService.recordTopScore(results.get(0).finalScore());
        span.setAttribute("tier", tier);
        span.setAttribute("results", results.size());
        span.setStatus(Span.SpanStatus.OK);
    }

    private float[] embedQuery(String text) {
        if (!embeddingProvider.isAvailable()) {
            return null;
        }
        try {
            return embeddingProvider.embed(text);
        } catch (RuntimeException e) {
            log.warn("embedding.failed provider={} error={}", embeddingProvider.getProviderName(), e.toString());
            metricsService.incrementSignalFailure(SignalType.VECTOR);
            return null;
        }
    }

    private void notifyReferenced(CatalogScope scope, List<MatchCandidate> results) {
        if (!options.isTrackReferences()) {
            return;
        }
        List<String> exampleIds = results.stream()
                .map(MatchCandidate::trainingExampleId)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        if (exampleIds.isEmpty()) {
            return;
        }
        try {
            referenceListener.onExamplesReferenced(scope, exampleIds);
        } catch (RuntimeException e) {
            log.debug("Reference tracking failed for {} examples: {}", exampleIds.size(), e.toString());
        }
    }
}
