package com.invoice.memory.metrics;

import com.invoice.memory.decision.DecisionOutcome;

import java.time.Duration;

/**
 * Metrics hooks for the normalization pipeline.
 * {@link NoOpMetricsService} is the default, so nothing is required on the classpath.
 */
public interface MetricsService {

    void recordPipelineDuration(DecisionOutcome outcome, Duration duration);

    void recordProposedCorrections(int count);

    void recordAutoAppliedCorrections(int count);

    void recordConfidenceScore(double score);

    void incrementEscalated(String vendor);

    void incrementDuplicate(String vendor);

    void incrementReinforced(String pattern);

    void incrementPenalized(String pattern);

    void recordBatchSize(int size);
}
