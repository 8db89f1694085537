package com.invoice.memory.api;

import com.invoice.memory.decision.ReinforcementPolicy;

/**
 * Numeric policy of the decision pipeline: the automation threshold, the
 * learning curve and the duplicate window.
 */
public class PipelineOptions {

    public static final double DEFAULT_AUTO_CORRECT_THRESHOLD = 0.8;
    public static final double DEFAULT_MAX_CONFIDENCE = 0.95;
    public static final double DEFAULT_REJECTION_PENALTY = 0.3;
    public static final double DEFAULT_LOW_CONFIDENCE_LEARNING_RATE = 0.05;
    public static final int DEFAULT_DUPLICATE_WINDOW_DAYS = 2;

    private final double autoCorrectThreshold;
    private final double maxConfidence;
    private final double rejectionPenalty;
    private final double lowConfidenceLearningRate;
    private final int duplicateWindowDays;

    private PipelineOptions(Builder builder) {
        this.autoCorrectThreshold = builder.autoCorrectThreshold;
        this.maxConfidence = builder.maxConfidence;
        this.rejectionPenalty = builder.rejectionPenalty;
        this.lowConfidenceLearningRate = builder.lowConfidenceLearningRate;
        this.duplicateWindowDays = builder.duplicateWindowDays;
    }

    /**
     * Confidence at or above which a correction is applied without sign-off,
     * and the aggregate below which a document is escalated.
     */
    public double getAutoCorrectThreshold() {
        return autoCorrectThreshold;
    }

    public double getMaxConfidence() {
        return maxConfidence;
    }

    public double getRejectionPenalty() {
        return rejectionPenalty;
    }

    public double getLowConfidenceLearningRate() {
        return lowConfidenceLearningRate;
    }

    public int getDuplicateWindowDays() {
        return duplicateWindowDays;
    }

    /**
     * Learning curve configured from these options.
     */
    public ReinforcementPolicy reinforcementPolicy() {
        return new ReinforcementPolicy(autoCorrectThreshold, maxConfidence,
                rejectionPenalty, lowConfidenceLearningRate);
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    /**
     * Options that never auto-apply: every proposal is escalated.
     */
    public static PipelineOptions reviewEverything() {
        return builder().autoCorrectThreshold(1.0).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PipelineOptions{" +
                "autoCorrectThreshold=" + autoCorrectThreshold +
                ", maxConfidence=" + maxConfidence +
                ", rejectionPenalty=" + rejectionPenalty +
                ", lowConfidenceLearningRate=" + lowConfidenceLearningRate +
                ", duplicateWindowDays=" + duplicateWindowDays +
                '}';
    }

    public static class Builder {
        private double autoCorrectThreshold = DEFAULT_AUTO_CORRECT_THRESHOLD;
        private double maxConfidence = DEFAULT_MAX_CONFIDENCE;
        private double rejectionPenalty = DEFAULT_REJECTION_PENALTY;
        private double lowConfidenceLearningRate = DEFAULT_LOW_CONFIDENCE_LEARNING_RATE;
        private int duplicateWindowDays = DEFAULT_DUPLICATE_WINDOW_DAYS;

        public Builder autoCorrectThreshold(double autoCorrectThreshold) {
            validateUnitInterval(autoCorrectThreshold, "autoCorrectThreshold");
            this.autoCorrectThreshold = autoCorrectThreshold;
            return this;
        }

        public Builder maxConfidence(double maxConfidence) {
            validateUnitInterval(maxConfidence, "maxConfidence");
            this.maxConfidence = maxConfidence;
            return this;
        }

        public Builder rejectionPenalty(double rejectionPenalty) {
            validateUnitInterval(rejectionPenalty, "rejectionPenalty");
            this.rejectionPenalty = rejectionPenalty;
            return this;
        }

        public Builder lowConfidenceLearningRate(double lowConfidenceLearningRate) {
            validateUnitInterval(lowConfidenceLearningRate, "lowConfidenceLearningRate");
            this.lowConfidenceLearningRate = lowConfidenceLearningRate;
            return this;
        }

        public Builder duplicateWindowDays(int duplicateWindowDays) {
            if (duplicateWindowDays < 0) {
                throw new IllegalArgumentException("duplicateWindowDays must be >= 0");
            }
            this.duplicateWindowDays = duplicateWindowDays;
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }

        private void validateUnitInterval(double value, String name) {
            if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
