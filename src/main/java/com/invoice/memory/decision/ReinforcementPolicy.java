package com.invoice.memory.decision;

import com.invoice.memory.core.model.Memory;
import com.invoice.memory.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Confidence update curve applied when feedback arrives for a memory.
 *
 * <p>Approval:</p>
 * <pre>
 * approvals    += 1
 * learningRate  = confidence &lt; threshold ? lowConfidenceRate : 1 / (approvals + 1)
 * confidence    = min(maxConfidence, confidence + learningRate)
 * </pre>
 *
 * <p>Rejection:</p>
 * <pre>
 * rejections += 1
 * confidence  = max(0, confidence - rejectionPenalty)
 * </pre>
 */
public class ReinforcementPolicy {
    private static final Logger log = LoggerFactory.getLogger(ReinforcementPolicy.class);

    private final double threshold;
    private final double maxConfidence;
    private final double rejectionPenalty;
    private final double lowConfidenceRate;

    public ReinforcementPolicy(double threshold, double maxConfidence,
                               double rejectionPenalty, double lowConfidenceRate) {
        if (maxConfidence < 0.0 || maxConfidence > 1.0) {
            throw new IllegalArgumentException("maxConfidence must be between 0.0 and 1.0");
        }
        if (rejectionPenalty < 0.0) {
            throw new IllegalArgumentException("rejectionPenalty must be non-negative");
        }
        if (lowConfidenceRate < 0.0) {
            throw new IllegalArgumentException("lowConfidenceRate must be non-negative");
        }
        this.threshold = threshold;
        this.maxConfidence = maxConfidence;
        this.rejectionPenalty = rejectionPenalty;
        this.lowConfidenceRate = lowConfidenceRate;
    }

    /**
     * Computes the new confidence and counters for a memory under the given verdict.
     *
     * @throws IllegalArgumentException if the verdict is {@link Verdict#NONE}
     */
    public LearningResult apply(Memory memory, Verdict verdict) {
        return switch (verdict) {
            case APPROVED -> reinforce(memory);
            case REJECTED -> penalize(memory);
            case NONE -> throw new IllegalArgumentException("No verdict to learn from");
        };
    }

    public LearningResult reinforce(Memory memory) {
        int approvals = memory.approvals() + 1;
        double learningRate = memory.confidence() < threshold
                ? lowConfidenceRate
                : 1.0 / (approvals + 1);
        double updated = Math.min(maxConfidence, memory.confidence() + learningRate);
        log.debug("Reinforced memory '{}': rate={} confidence {} -> {}",
                memory.pattern(), learningRate, memory.confidence(), updated);
        return new LearningResult(memory, updated, approvals, memory.rejections(), Verdict.APPROVED);
    }

    public LearningResult penalize(Memory memory) {
        int rejections = memory.rejections() + 1;
        double updated = Math.max(0.0, memory.confidence() - rejectionPenalty);
        log.debug("Penalized memory '{}': confidence {} -> {}",
                memory.pattern(), memory.confidence(), updated);
        return new LearningResult(memory, updated, memory.approvals(), rejections, Verdict.REJECTED);
    }

    /**
     * New state for a memory after one learning event.
     */
    public record LearningResult(Memory before, double newConfidence, int approvals, int rejections,
                                 Verdict verdict) {

        public double previousConfidence() {
            return before.confidence();
        }

        /**
         * Human-readable summary used in memory updates and audit trails.
         */
        public String describe() {
            return String.format(Locale.ROOT, "Memory \"%s\" updated: confidence %.2f -> %.2f (%s)",
                    before.pattern(), before.confidence(), newConfidence,
                    verdict == Verdict.APPROVED ? "reinforced" : "penalized");
        }
    }
}
