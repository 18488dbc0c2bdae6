package com.catalog.matching.tracing;

import com.catalog.matching.core.model.CatalogScope;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startMatchSpan("catalog.match", CatalogScope.defaultScope())) {
                    span.setAttribute("tier", "algorithmic");
                    span.setAttribute("results", 3L);
                    span.setAttribute("threshold", 0.3);
                    span.addEvent("training_exact.empty");
                    span.setStatus(Span.SpanStatus.OK);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return same shared span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("op1"), noOp.startSpan("op2", Map.of("k", "v")));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.setAttribute(anyString(), anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Should create span with the operation name")
        void createSpanWithName() {
            Span span = service.startSpan("catalog.match");

            assertNotNull(span);
            verify(tracer).spanBuilder("catalog.match");
            verify(builder).startSpan();
        }

        @Test
        @DisplayName("Unqualified attribute keys are namespaced")
        void qualifiesKeys() {
            Span span = service.startSpan("catalog.match");
            span.setAttribute("tier", "algorithmic");
            span.setAttribute("results", 4L);
            span.setAttribute("threshold", 0.3);

            verify(otelSpan).setAttribute("catalog.matching.tier", "algorithmic");
            verify(otelSpan).setAttribute("catalog.matching.results", 4L);
            verify(otelSpan).setAttribute("catalog.matching.threshold", 0.3);
        }

        @Test
        @DisplayName("Qualified keys pass through unchanged")
        void keepsQualifiedKeys() {
            service.startMatchSpan("catalog.match", CatalogScope.of("acme"));

            verify(builder).setAttribute("catalog.scope", "acme");
        }

        @Test
        @DisplayName("Initial attributes are namespaced too")
        void initialAttributes() {
            service.startSpan("catalog.match.tier", Map.of("tier", "fallback"));

            verify(builder).setAttribute("catalog.matching.tier", "fallback");
        }

        @Test
        @DisplayName("Should map status, record exceptions and end on close")
        void lifecycle() {
            RuntimeException error = new RuntimeException("boom");
            Span span = service.startSpan("catalog.match");
            span.addEvent("fallback.empty");
            span.recordException(error);
            span.setStatus(Span.SpanStatus.ERROR);
            span.setStatus(Span.SpanStatus.OK);
            span.close();

            verify(otelSpan).addEvent("fallback.empty");
            verify(otelSpan).recordException(error);
            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }
    }
}
