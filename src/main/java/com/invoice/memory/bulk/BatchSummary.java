package com.invoice.memory.bulk;

import java.util.List;

/**
 * Counts of a batch run by outcome.
 *
 * @param total         documents read
 * @param autoProcessed documents needing no review (auto-applied or nothing to correct)
 * @param humanReview   documents escalated for review
 * @param duplicates    documents flagged as duplicates
 * @param failed        documents whose processing threw
 * @param errors        one entry per failed document
 */
public record BatchSummary(
        long total,
        long autoProcessed,
        long humanReview,
        long duplicates,
        long failed,
        List<BatchError> errors
) {
    public BatchSummary {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param position   0-based position of the document in the batch
     * @param documentId the document id, if it could be read
     * @param message    the failure message
     */
    public record BatchError(long position, String documentId, String message) {}

    @Override
    public String toString() {
        return "BatchSummary{total=" + total +
                ", autoProcessed=" + autoProcessed +
                ", humanReview=" + humanReview +
                ", duplicates=" + duplicates +
                ", failed=" + failed + '}';
    }
}
