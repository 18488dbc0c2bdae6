package com.catalog.matching.tracing;

/**
 * A traced unit of work. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracingService.startMatchSpan("catalog.match", scope)) {
 *     span.setAttribute("tier", tier);
 *     span.setAttribute("top_score", best.finalScore());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    /**
     * Marks a point in time inside the span, e.g. a tier that yielded nothing.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
