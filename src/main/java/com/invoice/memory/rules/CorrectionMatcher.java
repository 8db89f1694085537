package com.invoice.memory.rules;

import com.invoice.memory.core.model.InvoiceDocument;

import java.util.List;

/**
 * Content predicate and value producer of a {@link CorrectionRule}.
 * Implementations must be pure: no side effects, no mutation of the document.
 * Absent fields mean "no match", never an error.
 */
@FunctionalInterface
public interface CorrectionMatcher {

    /**
     * @return the changes this matcher proposes, empty if the document does not match
     */
    List<FieldChange> match(InvoiceDocument document);
}
