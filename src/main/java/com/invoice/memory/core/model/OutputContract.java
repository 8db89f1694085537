package com.invoice.memory.core.model;

import com.invoice.memory.decision.DecisionOutcome;

import java.util.List;
import java.util.Objects;

/**
 * Result of one pipeline run. Fully determined by the input document,
 * the verdict, the memory state and the clock.
 *
 * @param normalizedDocument  copy of the fields with auto-applied corrections written in
 * @param proposedCorrections deduplicated corrections, at most one per field
 * @param requiresHumanReview whether the document must be escalated
 * @param reasoning           human-readable explanation of the decision
 * @param confidenceScore     mean confidence of the proposed corrections (0 if none)
 * @param memoryUpdates       one line per memory changed by the learn stage
 * @param auditTrail          ordered stage log
 * @param decision            branch taken by the decide stage
 */
public record OutputContract(
        InvoiceFields normalizedDocument,
        List<ProposedCorrection> proposedCorrections,
        boolean requiresHumanReview,
        String reasoning,
        double confidenceScore,
        List<String> memoryUpdates,
        List<AuditTrailEntry> auditTrail,
        DecisionOutcome decision
) {
    public OutputContract {
        Objects.requireNonNull(normalizedDocument, "normalizedDocument is required");
        Objects.requireNonNull(reasoning, "reasoning is required");
        Objects.requireNonNull(decision, "decision is required");
        proposedCorrections = proposedCorrections != null ? List.copyOf(proposedCorrections) : List.of();
        memoryUpdates = memoryUpdates != null ? List.copyOf(memoryUpdates) : List.of();
        auditTrail = auditTrail != null ? List.copyOf(auditTrail) : List.of();
    }
}
