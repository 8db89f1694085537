package com.invoice.memory.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable wrapper around the SLF4J MDC.
 * When a context closes, every key it set goes back to the value it had
 * before, so a document context nested in a batch context leaves the batch's
 * {@code operation} in place.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDocument(correlationId, "INV-A-001", "Supplier GmbH")) {
 *     log.info("pipeline.decide outcome={} confidence={}", outcome, score);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Context for one pipeline run over a document.
     */
    public static LogContext forDocument(String correlationId, String documentId, String vendor) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("documentId", documentId);
        ctx.put("vendor", vendor);
        ctx.put("operation", "process");
        return ctx;
    }

    /**
     * Context for a batch of documents.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    /**
     * Context for feeding a review verdict back into memory.
     */
    public static LogContext forReview(String correlationId, String reviewItemId, String verdict) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("reviewItemId", reviewItemId);
        ctx.put("verdict", verdict);
        ctx.put("operation", "review");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another key to this context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
