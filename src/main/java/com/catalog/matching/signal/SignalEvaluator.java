package com.catalog.matching.signal;

import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalScores;
import com.catalog.matching.core.model.SignalType;
import com.catalog.matching.metrics.MetricsService;
import com.catalog.matching.store.CatalogUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every configured signal for a product. A signal that throws is logged, counted and
 * scored 0; the other signals are unaffected. Only {@link CatalogUnavailableException} escapes.
 */
public class SignalEvaluator {
    private static final Logger log = LoggerFactory.getLogger(SignalEvaluator.class);

    private final List<ProductSignal> signals;
    private final MetricsService metricsService;

    public SignalEvaluator(List<ProductSignal> signals, MetricsService metricsService) {
        this.signals = List.copyOf(signals);
        this.metricsService = metricsService;
    }

    public SignalScores evaluate(QueryContext query, Product product) {
        Map<SignalType, Double> scores = new EnumMap<>(SignalType.class);
        for (ProductSignal signal : signals) {
            scores.merge(signal.type(), safeScore(signal, query, product), Math::max);
        }
        return new SignalScores(
                scores.getOrDefault(SignalType.VECTOR, 0.0),
                scores.getOrDefault(SignalType.TRIGRAM, 0.0),
                scores.getOrDefault(SignalType.FUZZY, 0.0),
                scores.getOrDefault(SignalType.ALIAS, 0.0),
                scores.getOrDefault(SignalType.LEARNED, 0.0));
    }

    private double safeScore(ProductSignal signal, QueryContext query, Product product) {
        try {
            double value = signal.score(query, product);
            if (Double.isNaN(value)) {
                return 0.0;
            }
            return Math.max(0.0, Math.min(1.0, value));
        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("signal.failed signal={} productId={} error={}", signal.type(), product.id(), e.toString());
            log.debug("Signal failure detail", e);
            metricsService.incrementSignalFailure(signal.type());
            return 0.0;
        }
    }
}
