package com.invoice.memory.pipeline;

import com.invoice.memory.core.model.AuditTrailEntry;

import java.util.List;

/**
 * What a learn pass changed.
 *
 * @param memoryUpdates one line per memory updated
 * @param auditTrail    learn-stage audit entries, including skipped patterns
 */
public record LearningReport(List<String> memoryUpdates, List<AuditTrailEntry> auditTrail) {

    public LearningReport {
        memoryUpdates = memoryUpdates != null ? List.copyOf(memoryUpdates) : List.of();
        auditTrail = auditTrail != null ? List.copyOf(auditTrail) : List.of();
    }
}
