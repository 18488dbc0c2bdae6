package com.catalog.matching.store;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.TrainingExample;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory training store. Examples are indexed per scope by id, by (normalized text,
 * product id) and by product id. Writes to a scope are serialized so the indexes stay in step.
 */
public class InMemoryTrainingDataStore implements TrainingDataStore {

    private static final Comparator<TrainingExample> MOST_RECENT_FIRST =
            Comparator.comparing(TrainingExample::getApprovedAt).reversed()
                    .thenComparing(TrainingExample::getId);

    private final Map<CatalogScope, ScopeExamples> examples = new ConcurrentHashMap<>();

    @Override
    public List<TrainingExample> findAll(CatalogScope scope) {
        return scoped(scope).byId.values().stream()
                .sorted(Comparator.comparing(TrainingExample::getId))
                .collect(Collectors.toList());
    }

    @Override
    public List<TrainingExample> findTrainable(CatalogScope scope, Instant approvedSince) {
        return scoped(scope).byId.values().stream()
                .filter(e -> e.getQuality().isTrainable())
                .filter(e -> !e.getApprovedAt().isBefore(approvedSince))
                .sorted(Comparator.comparing(TrainingExample::getId))
                .collect(Collectors.toList());
    }

    @Override
    public List<TrainingExample> findByProduct(CatalogScope scope, String productId) {
        ScopeExamples scoped = scoped(scope);
        Set<String> ids = scoped.byProduct.get(productId);
        if (ids == null) {
            return List.of();
        }
        return ids.stream()
                .map(scoped.byId::get)
                .filter(Objects::nonNull)
                .sorted(MOST_RECENT_FIRST)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<TrainingExample> findById(CatalogScope scope, String exampleId) {
        return Optional.ofNullable(scoped(scope).byId.get(exampleId));
    }

    @Override
    public Optional<TrainingExample> findByKey(CatalogScope scope, String normalizedText, String productId) {
        ScopeExamples scoped = scoped(scope);
        String id = scoped.byKey.get(key(normalizedText, productId));
        return id != null ? Optional.ofNullable(scoped.byId.get(id)) : Optional.empty();
    }

    @Override
    public TrainingExample save(TrainingExample example) {
        ScopeExamples scoped = scoped(example.getScope());
        synchronized (scoped) {
            TrainingExample previous = scoped.byId.put(example.getId(), example);
            if (previous != null) {
                unindex(scoped, previous);
            }
            scoped.byKey.put(key(example.getNormalizedText(), example.getProductId()), example.getId());
            scoped.byProduct.computeIfAbsent(example.getProductId(), p -> ConcurrentHashMap.newKeySet())
                    .add(example.getId());
            scoped.version.incrementAndGet();
        }
        return example;
    }

    @Override
    public Optional<TrainingExample> recordReference(CatalogScope scope, String exampleId, Instant at) {
        return Optional.ofNullable(scoped(scope).byId.computeIfPresent(exampleId, (id, e) -> e.referenced(at)));
    }

    @Override
    public int count(CatalogScope scope) {
        return scoped(scope).byId.size();
    }

    @Override
    public long version(CatalogScope scope) {
        ScopeExamples scoped = examples.get(scope);
        return scoped != null ? scoped.version.get() : 0L;
    }

    private void unindex(ScopeExamples scoped, TrainingExample previous) {
        scoped.byKey.remove(key(previous.getNormalizedText(), previous.getProductId()), previous.getId());
        Set<String> ids = scoped.byProduct.get(previous.getProductId());
        if (ids != null) {
            ids.remove(previous.getId());
        }
    }

    private static String key(String normalizedText, String productId) {
        return productId + '\u0000' + normalizedText;
    }

    private ScopeExamples scoped(CatalogScope scope) {
        return examples.computeIfAbsent(scope, s -> new ScopeExamples());
    }

    private static final class ScopeExamples {
        final Map<String, TrainingExample> byId = new ConcurrentHashMap<>();
        final Map<String, String> byKey = new ConcurrentHashMap<>();
        final Map<String, Set<String>> byProduct = new ConcurrentHashMap<>();
        final AtomicLong version = new AtomicLong();
    }
}
