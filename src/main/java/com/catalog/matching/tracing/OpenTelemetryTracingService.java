package com.catalog.matching.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 * Attribute keys are namespaced under {@code catalog.matching.} unless already qualified.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String ATTRIBUTE_PREFIX = "catalog.matching.";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName) {
        return new MatchSpan(tracer.spanBuilder(operationName).startSpan());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach((key, value) -> builder.setAttribute(qualify(key), value));
        }
        return new MatchSpan(builder.startSpan());
    }

    static String qualify(String key) {
        return key.indexOf('.') >= 0 ? key : ATTRIBUTE_PREFIX + key;
    }

    private static final class MatchSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        MatchSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(qualify(key), value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(qualify(key), value);
        }

        @Override
        public void setAttribute(String key, double value) {
            delegate.setAttribute(qualify(key), value);
        }

        @Override
        public void addEvent(String name) {
            delegate.addEvent(name);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
