package com.catalog.matching.training;

import com.catalog.matching.api.MatchOptions;
import com.catalog.matching.audit.AuditAction;
import com.catalog.matching.audit.AuditEntry;
import com.catalog.matching.audit.AuditService;
import com.catalog.matching.cache.MatchCache;
import com.catalog.matching.core.model.Alias;
import com.catalog.matching.core.model.AliasSource;
import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.TrainingExample;
import com.catalog.matching.lock.DistributedLock;
import com.catalog.matching.logging.LogContext;
import com.catalog.matching.metrics.MetricsService;
import com.catalog.matching.rules.NormalizationEngine;
import com.catalog.matching.store.AliasStore;
import com.catalog.matching.store.CatalogStore;
import com.catalog.matching.store.PersistenceException;
import com.catalog.matching.store.TrainingDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Writes reviewer approvals back into the training and alias stores.
 *
 * <p>Approvals are idempotent per (scope, normalized text, product id): a repeated approval
 * updates scores, quality, confidence and approval time of the existing example but keeps its
 * id, manual weight and reference counter. Writes for the same key are serialized through the
 * {@link DistributedLock}; other keys proceed in parallel.</p>
 *
 * <p>Persistence failures are retried with linear backoff and then reported in the
 * {@link ApprovalAck}; {@link #recordApproval} never throws for them.</p>
 */
public class TrainingFeedbackRecorder implements TrainingReferenceListener {
    private static final Logger log = LoggerFactory.getLogger(TrainingFeedbackRecorder.class);

    private final TrainingDataStore trainingStore;
    private final AliasStore aliasStore;
    private final CatalogStore catalogStore;
    private final NormalizationEngine normalizer;
    private final DistributedLock lock;
    private final MatchCache cache;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final MatchOptions options;
    private final Clock clock;

    public TrainingFeedbackRecorder(TrainingDataStore trainingStore,
                                    AliasStore aliasStore,
                                    CatalogStore catalogStore,
                                    NormalizationEngine normalizer,
                                    DistributedLock lock,
                                    MatchCache cache,
                                    AuditService auditService,
                                    MetricsService metricsService,
                                    MatchOptions options,
                                    Clock clock) {
        this.trainingStore = Objects.requireNonNull(trainingStore, "trainingStore is required");
        this.aliasStore = Objects.requireNonNull(aliasStore, "aliasStore is required");
        this.catalogStore = Objects.requireNonNull(catalogStore, "catalogStore is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.lock = Objects.requireNonNull(lock, "lock is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    // ========== Approvals ==========

    /**
     * Records an approval as a training example and, for EXCELLENT or GOOD approvals of
     * non-trivial text, as an alias of the product. Store and lock failures of any kind are
     * reported through {@link ApprovalAck#failed} rather than thrown.
     *
     * @throws IllegalArgumentException if the line item normalizes to empty text
     */
    public ApprovalAck recordApproval(ApprovalRequest request) {
        Objects.requireNonNull(request, "request is required");
        String normalized = normalizer.normalize(request.lineItemText());
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("lineItemText normalizes to empty text");
        }
        CatalogScope scope = request.scope();

        try (LogContext ignored = LogContext.forApproval(
                LogContext.generateCorrelationId(), scope.tenantId(), request.productId())) {
            Optional<Product> product = snapshotProduct(scope, request.productId());
            String key = lockKey(scope, normalized, request.productId());

            ApprovalAck ack;
            try {
                ack = lock.withLock(key, () -> write(request, normalized, product.orElse(null)));
            } catch (RuntimeException e) {
                return fail(request, normalized, e);
            }

            cache.invalidate(scope);
            metricsService.incrementApprovalRecorded();
            auditService.record(AuditEntry.builder()
                    .action(AuditAction.APPROVAL_RECORDED)
                    .scope(scope.tenantId())
                    .subjectId(ack.exampleId())
                    .actorId(request.approvedBy())
                    .detail("productId", request.productId())
                    .detail("quality", request.quality().name())
                    .detail("created", ack.created())
                    .build());
            log.info("approval.recorded exampleId={} productId={} quality={} created={} alias={}",
                    ack.exampleId(), request.productId(), request.quality(), ack.created(), ack.aliasUpserted());
            return ack;
        }
    }

    private ApprovalAck write(ApprovalRequest request, String normalized, Product product) {
        CatalogScope scope = request.scope();
        Instant now = clock.instant();

        Optional<TrainingExample> existing = withRetry("training.lookup",
                () -> trainingStore.findByKey(scope, normalized, request.productId()));
        TrainingExample.Builder builder = existing
                .map(TrainingExample::toBuilder)
                .orElseGet(() -> TrainingExample.builder()
                        .scope(scope)
                        .normalizedText(normalized)
                        .productId(request.productId())
                        .createdAt(now));
        if (product != null) {
            builder.productSku(product.sku()).productName(product.name());
        }
        TrainingExample example = builder
                .lineItemText(request.lineItemText().trim())
                .scores(request.scores())
                .finalScore(request.finalScore())
                .quality(request.quality())
                .confidence(request.confidence())
                .approvedBy(request.approvedBy())
                .approvedAt(now)
                .updatedAt(now)
                .build();
        TrainingExample saved = withRetry("training.save", () -> trainingStore.save(example));

        boolean aliasUpserted = false;
        if (qualifiesForAlias(request)) {
            aliasUpserted = upsertAlias(request, normalized, now);
        }
        return ApprovalAck.stored(saved.getId(), existing.isEmpty(), aliasUpserted);
    }

    private boolean qualifiesForAlias(ApprovalRequest request) {
        return request.quality().isTrainable()
                && request.lineItemText().trim().length() > options.getAliasMinTextLength();
    }

    /**
     * Alias failures are logged; the training example is already stored.
     */
    private boolean upsertAlias(ApprovalRequest request, String normalized, Instant now) {
        CatalogScope scope = request.scope();
        double confidence = Math.min(1.0, request.confidence());
        try {
            Alias alias = withRetry("alias.upsert", () -> {
                Optional<Alias> existing = aliasStore.find(scope, normalized, request.productId());
                Alias.Builder builder = existing
                        .map(Alias::toBuilder)
                        .orElseGet(() -> Alias.builder()
                                .scope(scope)
                                .productId(request.productId())
                                .normalizedName(normalized)
                                .source(AliasSource.APPROVAL)
                                .createdBy(request.approvedBy())
                                .createdAt(now));
                double merged = existing.map(a -> Math.max(a.getConfidence(), confidence)).orElse(confidence);
                return aliasStore.upsert(builder
                        .externalName(request.lineItemText().trim())
                        .confidence(merged)
                        .updatedAt(now)
                        .build());
            });
            metricsService.incrementAliasUpserted();
            auditService.record(AuditEntry.builder()
                    .action(AuditAction.ALIAS_UPSERTED)
                    .scope(scope.tenantId())
                    .subjectId(alias.getId())
                    .actorId(request.approvedBy())
                    .detail("productId", alias.getProductId())
                    .detail("confidence", alias.getConfidence())
                    .build());
            return true;
        } catch (RuntimeException e) {
            log.warn("alias.upsert_failed productId={} error={}", request.productId(), e.getMessage());
            return false;
        }
    }

    private ApprovalAck fail(ApprovalRequest request, String normalized, RuntimeException e) {
        metricsService.incrementApprovalFailed();
        auditService.record(AuditEntry.builder()
                .action(AuditAction.APPROVAL_FAILED)
                .scope(request.scope().tenantId())
                .subjectId(request.productId())
                .actorId(request.approvedBy())
                .detail("normalizedText", normalized)
                .detail("error", e.getMessage())
                .build());
        log.error("approval.failed productId={} text='{}' error={}", request.productId(), normalized, e.getMessage());
        return ApprovalAck.failed(e.getMessage());
    }

    // ========== References and weights ==========

    @Override
    public void onExamplesReferenced(CatalogScope scope, Collection<String> exampleIds) {
        for (String exampleId : exampleIds) {
            touchReference(scope, exampleId);
        }
    }

    /**
     * Bumps the reference counter of an example. Best effort; never throws.
     */
    public void touchReference(CatalogScope scope, String exampleId) {
        try {
            trainingStore.recordReference(scope, exampleId, clock.instant());
        } catch (RuntimeException e) {
            log.warn("training.reference_failed exampleId={} error={}", exampleId, e.toString());
        }
    }

    /**
     * Sets the manual weight of an example.
     *
     * @return the updated example, or empty if no example has that id
     * @throws IllegalArgumentException if the weight is negative
     * @throws PersistenceException     if the write still fails after retries
     */
    public Optional<TrainingExample> updateWeight(CatalogScope scope, String exampleId, double weight, String updatedBy) {
        if (weight < 0.0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("weight must be >= 0");
        }
        Optional<TrainingExample> current = trainingStore.findById(scope, exampleId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        TrainingExample found = current.get();
        String key = lockKey(scope, found.getNormalizedText(), found.getProductId());

        TrainingExample updated = lock.withLock(key, () -> {
            TrainingExample latest = trainingStore.findById(scope, exampleId).orElse(found);
            TrainingExample next = latest.toBuilder()
                    .weight(weight)
                    .updatedAt(clock.instant())
                    .build();
            return withRetry("training.weight", () -> trainingStore.save(next));
        });

        cache.invalidate(scope);
        auditService.record(AuditEntry.builder()
                .action(AuditAction.TRAINING_WEIGHT_UPDATED)
                .scope(scope.tenantId())
                .subjectId(exampleId)
                .actorId(updatedBy)
                .detail("previousWeight", found.getWeight())
                .detail("weight", weight)
                .build());
        log.info("training.weight_updated exampleId={} weight={} previous={}", exampleId, weight, found.getWeight());
        return Optional.of(updated);
    }

    // ========== Internals ==========

    private Optional<Product> snapshotProduct(CatalogScope scope, String productId) {
        try {
            return catalogStore.findById(scope, productId);
        } catch (RuntimeException e) {
            log.debug("Product snapshot unavailable for {}: {}", productId, e.toString());
            return Optional.empty();
        }
    }

    private <T> T withRetry(String operation, Supplier<T> action) {
        int attempts = options.getApprovalAttempts();
        Duration delay = options.getApprovalRetryDelay();
        PersistenceException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return action.get();
            } catch (PersistenceException e) {
                last = e;
                log.warn("{}.retry attempt={}/{} error={}", operation, attempt, attempts, e.getMessage());
                if (attempt < attempts) {
                    pause(delay.multipliedBy(attempt));
                }
            }
        }
        throw last;
    }

    private void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceException("Interrupted while waiting to retry", e);
        }
    }

    static String lockKey(CatalogScope scope, String normalizedText, String productId) {
        return "training:" + scope.tenantId() + ":" + productId + ":" + normalizedText;
    }
}
