package com.invoice.memory.evaluation;

/**
 * Verdict reported by a {@link GroundTruthEvaluator}.
 */
public enum EvaluationStatus {
    APPROVED,
    REJECTED
}
