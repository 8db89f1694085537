package com.invoice.memory.evaluation;

import com.invoice.memory.core.model.Verdict;

import java.util.Objects;

/**
 * Result of a ground-truth evaluation.
 *
 * @param status the verdict
 * @param reason free-text explanation from the evaluator
 */
public record Evaluation(EvaluationStatus status, String reason) {

    public Evaluation {
        Objects.requireNonNull(status, "status is required");
        reason = reason != null ? reason : "";
    }

    public static Evaluation approved(String reason) {
        return new Evaluation(EvaluationStatus.APPROVED, reason);
    }

    public static Evaluation rejected(String reason) {
        return new Evaluation(EvaluationStatus.REJECTED, reason);
    }

    public Verdict toVerdict() {
        return status == EvaluationStatus.APPROVED ? Verdict.APPROVED : Verdict.REJECTED;
    }
}
