package com.catalog.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable SLF4J MDC wrapper. Keys added through a context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMatch(correlationId, scope.tenantId())) {
 *     log.info("match.completed tier={} results={}", tier, results.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forMatch(String correlationId, String scope) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("scope", scope);
        ctx.put("operation", "match");
        return ctx;
    }

    public static LogContext forBatch(String batchId, String scope) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("scope", scope);
        ctx.put("operation", "batch");
        return ctx;
    }

    public static LogContext forApproval(String correlationId, String scope, String productId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("scope", scope);
        ctx.put("productId", productId);
        ctx.put("operation", "approval");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
