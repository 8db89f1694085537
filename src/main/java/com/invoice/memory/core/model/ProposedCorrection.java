package com.invoice.memory.core.model;

import java.util.Objects;

/**
 * A candidate field change produced by matching a memory against a document.
 * The confidence is always the triggering memory's confidence.
 *
 * @param field          target field path, e.g. {@code lineItems[2].sku}
 * @param from           current value in the document (may be null)
 * @param to             proposed value
 * @param sourceMemoryId id of the memory that triggered the proposal
 * @param confidence     confidence of the source memory
 */
public record ProposedCorrection(
        String field,
        Object from,
        Object to,
        String sourceMemoryId,
        double confidence
) {
    public ProposedCorrection {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(sourceMemoryId, "sourceMemoryId is required");
    }

    public FieldPath path() {
        return FieldPath.parse(field);
    }
}
