package com.invoice.memory.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of the per-document audit trail returned with every pipeline result.
 */
public record AuditTrailEntry(PipelineStep step, Instant timestamp, String details) {

    public AuditTrailEntry {
        Objects.requireNonNull(step, "step is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(details, "details is required");
    }
}
