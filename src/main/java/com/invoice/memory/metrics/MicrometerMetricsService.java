package com.invoice.memory.metrics;

import com.invoice.memory.decision.DecisionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code invoice.pipeline.duration}: Timer (tag: outcome)</li>
 *   <li>{@code invoice.corrections.proposed}: DistributionSummary</li>
 *   <li>{@code invoice.corrections.applied}: DistributionSummary</li>
 *   <li>{@code invoice.confidence.score}: DistributionSummary</li>
 *   <li>{@code invoice.escalated}: Counter (tag: vendor)</li>
 *   <li>{@code invoice.duplicates}: Counter (tag: vendor)</li>
 *   <li>{@code memory.reinforced}: Counter (tag: pattern)</li>
 *   <li>{@code memory.penalized}: Counter (tag: pattern)</li>
 *   <li>{@code invoice.batch.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<DecisionOutcome, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary proposedSummary;
    private final DistributionSummary appliedSummary;
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.proposedSummary = DistributionSummary.builder("invoice.corrections.proposed")
                .description("Corrections proposed per document after deduplication")
                .register(registry);
        this.appliedSummary = DistributionSummary.builder("invoice.corrections.applied")
                .description("Corrections auto-applied per document")
                .register(registry);
        this.confidenceSummary = DistributionSummary.builder("invoice.confidence.score")
                .description("Aggregate confidence of proposed corrections")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("invoice.batch.size")
                .description("Documents per batch")
                .register(registry);
    }

    @Override
    public void recordPipelineDuration(DecisionOutcome outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, o ->
                Timer.builder("invoice.pipeline.duration")
                        .description("Duration of one pipeline run")
                        .tag("outcome", o.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordProposedCorrections(int count) {
        proposedSummary.record(count);
    }

    @Override
    public void recordAutoAppliedCorrections(int count) {
        appliedSummary.record(count);
    }

    @Override
    public void recordConfidenceScore(double score) {
        confidenceSummary.record(score);
    }

    @Override
    public void incrementEscalated(String vendor) {
        counter("invoice.escalated", "vendor", vendor, "Documents escalated to human review").increment();
    }

    @Override
    public void incrementDuplicate(String vendor) {
        counter("invoice.duplicates", "vendor", vendor, "Documents flagged as duplicates").increment();
    }

    @Override
    public void incrementReinforced(String pattern) {
        counter("memory.reinforced", "pattern", pattern, "Memories reinforced by approval").increment();
    }

    @Override
    public void incrementPenalized(String pattern) {
        counter("memory.penalized", "pattern", pattern, "Memories penalized by rejection").increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
