package com.catalog.matching.tracing;

import com.catalog.matching.core.model.CatalogScope;

import java.util.Map;

/**
 * Tracing hook for match queries and tier evaluations.
 * {@link NoOpTracingService} is the default when no tracer is configured.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Span tagged with the catalog scope it runs against.
     */
    default Span startMatchSpan(String operationName, CatalogScope scope) {
        return startSpan(operationName, Map.of("catalog.scope", scope.tenantId()));
    }
}
