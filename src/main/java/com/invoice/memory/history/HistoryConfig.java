package com.invoice.memory.history;

import java.time.Duration;
import java.util.Objects;

/**
 * Retention policy for processed-document history.
 *
 * @param maxSize   maximum number of documents retained
 * @param retention how long a document stays eligible for duplicate matching
 */
public record HistoryConfig(int maxSize, Duration retention) {

    public HistoryConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        Objects.requireNonNull(retention, "retention is required");
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive");
        }
    }

    /**
     * Default history: 10,000 documents, 30 days.
     */
    public static HistoryConfig defaults() {
        return new HistoryConfig(10_000, Duration.ofDays(30));
    }
}
