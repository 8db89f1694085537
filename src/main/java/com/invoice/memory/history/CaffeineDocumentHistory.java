package com.invoice.memory.history;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.invoice.memory.core.model.InvoiceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine-backed document history bounded by size and age.
 * Keyed by document id, so resubmitting the same document replaces its entry.
 */
public class CaffeineDocumentHistory implements DocumentHistory {
    private static final Logger log = LoggerFactory.getLogger(CaffeineDocumentHistory.class);

    private final Cache<String, InvoiceDocument> documents;

    public CaffeineDocumentHistory() {
        this(HistoryConfig.defaults());
    }

    public CaffeineDocumentHistory(HistoryConfig config) {
        this(config, Ticker.systemTicker());
    }

    /**
     * Creates a history whose retention runs on the given clock, the same one
     * that stamps decay and audit entries.
     */
    public CaffeineDocumentHistory(HistoryConfig config, Clock clock) {
        this(config, clockTicker(clock));
    }

    /**
     * Creates a history with an explicit ticker. Visible for testing.
     */
    public CaffeineDocumentHistory(HistoryConfig config, Ticker ticker) {
        this.documents = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.retention())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        log.info("CaffeineDocumentHistory initialized: maxSize={}, retention={}",
                config.maxSize(), config.retention());
    }

    static Ticker clockTicker(Clock clock) {
        Objects.requireNonNull(clock, "clock is required");
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }

    @Override
    public void record(InvoiceDocument document) {
        documents.put(document.documentId(), document);
    }

    @Override
    public List<InvoiceDocument> findByInvoiceNumber(String vendor, String invoiceNumber) {
        if (invoiceNumber == null) {
            return List.of();
        }
        return documents.asMap().values().stream()
                .filter(d -> d.vendor().equals(vendor))
                .filter(d -> Objects.equals(d.fields().invoiceNumber(), invoiceNumber))
                .toList();
    }

    @Override
    public long size() {
        documents.cleanUp();
        return documents.estimatedSize();
    }

    @Override
    public void clear() {
        documents.invalidateAll();
    }
}
