package com.invoice.memory.metrics;

import com.invoice.memory.decision.DecisionOutcome;

import java.time.Duration;

/**
 * Does nothing.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordPipelineDuration(DecisionOutcome outcome, Duration duration) {
    }

    @Override
    public void recordProposedCorrections(int count) {
    }

    @Override
    public void recordAutoAppliedCorrections(int count) {
    }

    @Override
    public void recordConfidenceScore(double score) {
    }

    @Override
    public void incrementEscalated(String vendor) {
    }

    @Override
    public void incrementDuplicate(String vendor) {
    }

    @Override
    public void incrementReinforced(String pattern) {
    }

    @Override
    public void incrementPenalized(String pattern) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
