package com.invoice.memory.tracing;

import java.util.Map;

/**
 * Opens spans for {@code invoice.process} and {@code invoice.learn} calls.
 */
public interface TracingService {

    /**
     * @param attributes initial attributes, typically the document id and vendor
     */
    Span startSpan(String operationName, Map<String, String> attributes);
}
