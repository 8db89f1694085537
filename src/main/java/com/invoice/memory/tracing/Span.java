package com.invoice.memory.tracing;

/**
 * A traced unit of work, ended on {@link #close()}.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("invoice.process", Map.of("vendor", document.vendor()))) {
 *     span.setAttribute("outcome", result.decision().name());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
