package com.invoice.memory.core.model;

import java.util.Objects;

/**
 * Identity of a memory inside a store: one record per vendor and pattern.
 */
public record MemoryKey(String vendor, String pattern) {

    public MemoryKey {
        Objects.requireNonNull(vendor, "vendor is required");
        Objects.requireNonNull(pattern, "pattern is required");
    }

    /**
     * Lock key used to serialize read-modify-write cycles on this memory.
     */
    public String lockKey() {
        return vendor + "::" + pattern;
    }
}
