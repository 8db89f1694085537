package com.invoice.memory.evaluation;

import com.invoice.memory.core.model.InvoiceDocument;

/**
 * Opaque oracle that judges whether a document was handled correctly.
 * Consumed by the review workflow; the pipeline itself only sees the resulting verdict.
 */
@FunctionalInterface
public interface GroundTruthEvaluator {

    Evaluation evaluate(InvoiceDocument document);
}
