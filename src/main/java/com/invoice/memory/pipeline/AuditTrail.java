package com.invoice.memory.pipeline;

import com.invoice.memory.core.model.AuditTrailEntry;
import com.invoice.memory.core.model.PipelineStep;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered stage log of a single pipeline call. Not thread-safe; owned by one call.
 */
class AuditTrail {

    private final Clock clock;
    private final List<AuditTrailEntry> entries = new ArrayList<>();

    AuditTrail(Clock clock) {
        this.clock = clock;
    }

    void add(PipelineStep step, String details) {
        entries.add(new AuditTrailEntry(step, clock.instant(), details));
    }

    List<AuditTrailEntry> entries() {
        return List.copyOf(entries);
    }
}
