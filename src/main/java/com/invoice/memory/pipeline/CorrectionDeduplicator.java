package com.invoice.memory.pipeline;

import com.invoice.memory.core.model.ProposedCorrection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces candidate corrections to at most one per field path.
 * The highest-confidence candidate wins; on a tie the first one seen is kept.
 * Fields keep the order in which they were first proposed.
 */
public final class CorrectionDeduplicator {

    private CorrectionDeduplicator() {
    }

    public static List<ProposedCorrection> deduplicate(List<ProposedCorrection> candidates) {
        Map<String, ProposedCorrection> best = new LinkedHashMap<>();
        for (ProposedCorrection candidate : candidates) {
            ProposedCorrection existing = best.get(candidate.field());
            if (existing == null || candidate.confidence() > existing.confidence()) {
                best.put(candidate.field(), candidate);
            }
        }
        return new ArrayList<>(best.values());
    }
}
