package com.invoice.memory.pipeline;

import com.invoice.memory.api.PipelineOptions;
import com.invoice.memory.audit.AuditAction;
import com.invoice.memory.audit.AuditService;
import com.invoice.memory.core.model.InvoiceDocument;
import com.invoice.memory.core.model.InvoiceFields;
import com.invoice.memory.core.model.Memory;
import com.invoice.memory.core.model.MemoryKey;
import com.invoice.memory.core.model.MemoryType;
import com.invoice.memory.core.model.OutputContract;
import com.invoice.memory.core.model.PipelineStep;
import com.invoice.memory.core.model.ProposedCorrection;
import com.invoice.memory.core.model.Verdict;
import com.invoice.memory.decision.DecisionOutcome;
import com.invoice.memory.decision.ReinforcementPolicy;
import com.invoice.memory.history.CaffeineDocumentHistory;
import com.invoice.memory.history.DuplicateGuard;
import com.invoice.memory.history.HistoryConfig;
import com.invoice.memory.lock.DistributedLock;
import com.invoice.memory.lock.LocalDistributedLock;
import com.invoice.memory.logging.LogContext;
import com.invoice.memory.memory.MemoryStore;
import com.invoice.memory.metrics.MetricsService;
import com.invoice.memory.metrics.NoOpMetricsService;
import com.invoice.memory.rules.CorrectionRuleRegistry;
import com.invoice.memory.tracing.NoOpTracingService;
import com.invoice.memory.tracing.Span;
import com.invoice.memory.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one invoice through Recall, Apply, Decide and Learn.
 *
 * <p>The stages run linearly and never go back. A document matching a previously
 * processed one is short-circuited by the duplicate guard before recall. Learning
 * happens only when the caller supplies a verdict, and only through
 * {@link MemoryStore#updateConfidenceAndCounters}.</p>
 *
 * <pre>
 * DecisionPipeline pipeline = DecisionPipeline.builder()
 *     .memoryStore(store)
 *     .ruleRegistry(DefaultCorrectionRules.createDefaultRegistry())
 *     .build();
 *
 * OutputContract result = pipeline.process(document, Verdict.NONE);
 * </pre>
 */
public class DecisionPipeline {
    private static final Logger log = LoggerFactory.getLogger(DecisionPipeline.class);

    private final MemoryStore memoryStore;
    private final CorrectionRuleRegistry ruleRegistry;
    private final DuplicateGuard duplicateGuard;
    private final PipelineOptions options;
    private final ReinforcementPolicy reinforcementPolicy;
    private final DistributedLock lock;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;

    private DecisionPipeline(Builder builder) {
        this.memoryStore = builder.memoryStore;
        this.ruleRegistry = builder.ruleRegistry;
        this.options = builder.options;
        this.clock = builder.clock;
        this.duplicateGuard = builder.duplicateGuard != null
                ? builder.duplicateGuard
                : new DuplicateGuard(new CaffeineDocumentHistory(HistoryConfig.defaults(), clock),
                        options.getDuplicateWindowDays());
        this.reinforcementPolicy = options.reinforcementPolicy();
        this.lock = builder.lock != null ? builder.lock : new LocalDistributedLock();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService(clock);
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
    }

    /**
     * Processes a document without feedback.
     */
    public OutputContract process(InvoiceDocument document) {
        return process(document, Verdict.NONE);
    }

    /**
     * Processes a document with a nullable approval flag ({@code null} means no feedback).
     */
    public OutputContract process(InvoiceDocument document, Boolean humanApproved) {
        return process(document, Verdict.of(humanApproved));
    }

    /**
     * Processes a document and, if a verdict is present, learns from it.
     */
    public OutputContract process(InvoiceDocument document, Verdict verdict) {
        Objects.requireNonNull(document, "document is required");
        Objects.requireNonNull(verdict, "verdict is required");
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forDocument(LogContext.generateCorrelationId(),
                document.documentId(), document.vendor());
             Span span = tracingService.startSpan("invoice.process", Map.of(
                     "documentId", document.documentId(),
                     "vendor", document.vendor(),
                     "verdict", verdict.name()))) {
            try {
                OutputContract result = run(document, verdict);
                span.setAttribute("outcome", result.decision().name());
                span.setAttribute("corrections", result.proposedCorrections().size());
                span.setAttribute("confidence", result.confidenceScore());
                span.setStatus(Span.SpanStatus.OK);
                metricsService.recordPipelineDuration(result.decision(), Duration.ofNanos(System.nanoTime() - start));
                log.info("pipeline.completed outcome={} corrections={} confidence={} reviewRequired={}",
                        result.decision(), result.proposedCorrections().size(),
                        format(result.confidenceScore()), result.requiresHumanReview());
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    private OutputContract run(InvoiceDocument document, Verdict verdict) {
        AuditTrail trail = new AuditTrail(clock);

        Optional<InvoiceDocument> duplicateOf = duplicateGuard.findDuplicate(document);
        if (duplicateOf.isPresent()) {
            return duplicate(document, duplicateOf.get(), trail);
        }

        List<Memory> memories = recall(document, trail);
        List<ProposedCorrection> corrections = apply(document, memories, trail);

        double confidence = corrections.stream()
                .mapToDouble(ProposedCorrection::confidence)
                .average()
                .orElse(0.0);
        double threshold = options.getAutoCorrectThreshold();

        InvoiceFields normalized = document.fields();
        List<String> appliedFields = new ArrayList<>();
        for (ProposedCorrection correction : corrections) {
            if (correction.confidence() >= threshold) {
                normalized = normalized.with(correction.path(), correction.to());
                appliedFields.add(correction.field());
            }
        }

        boolean requiresHumanReview = !corrections.isEmpty() && confidence < threshold;
        DecisionOutcome outcome;
        String reasoning;
        List<String> proposedFields = corrections.stream().map(ProposedCorrection::field).toList();
        if (corrections.isEmpty()) {
            outcome = DecisionOutcome.NO_CORRECTIONS;
            reasoning = ReasoningTemplates.noCorrections(document.vendor());
            trail.add(PipelineStep.DECIDE, "No corrections proposed (avg confidence " + format(confidence) + ")");
        } else if (requiresHumanReview) {
            outcome = DecisionOutcome.ESCALATED;
            reasoning = ReasoningTemplates.escalated(document.vendor(), proposedFields, confidence);
            trail.add(PipelineStep.DECIDE, "Human review required (avg confidence " + format(confidence) + ")");
            metricsService.incrementEscalated(document.vendor());
            auditService.record(AuditAction.DOCUMENT_ESCALATED, document.documentId(), AuditService.PIPELINE_ACTOR,
                    Map.of("vendor", document.vendor(), "confidence", confidence, "fields", proposedFields));
        } else {
            outcome = DecisionOutcome.AUTO_APPLIED;
            reasoning = ReasoningTemplates.autoApplied(document.vendor(), appliedFields, confidence);
            trail.add(PipelineStep.DECIDE, "All corrections auto-applied (avg confidence " + format(confidence) + ")");
            auditService.record(AuditAction.CORRECTIONS_AUTO_APPLIED, document.documentId(),
                    AuditService.PIPELINE_ACTOR,
                    Map.of("vendor", document.vendor(), "confidence", confidence, "fields", appliedFields));
        }
        metricsService.recordAutoAppliedCorrections(appliedFields.size());
        metricsService.recordConfidenceScore(confidence);
        log.debug("pipeline.decide outcome={} confidence={} applied={}", outcome, format(confidence), appliedFields);

        List<String> memoryUpdates = List.of();
        if (verdict.present()) {
            memoryUpdates = learn(document, corrections, verdict, trail);
        }

        duplicateGuard.remember(document);

        return new OutputContract(normalized, corrections, requiresHumanReview, reasoning, confidence,
                memoryUpdates, trail.entries(), outcome);
    }

    private OutputContract duplicate(InvoiceDocument document, InvoiceDocument previous, AuditTrail trail) {
        trail.add(PipelineStep.DECIDE,
                "Potential duplicate invoice detected (same vendor + invoice number + close dates)");
        log.info("pipeline.duplicate previousDocumentId={} invoiceNumber={}",
                previous.documentId(), document.fields().invoiceNumber());
        metricsService.incrementDuplicate(document.vendor());
        auditService.record(AuditAction.DUPLICATE_DETECTED, document.documentId(), AuditService.PIPELINE_ACTOR,
                Map.of("vendor", document.vendor(), "previousDocumentId", previous.documentId()));
        return new OutputContract(document.fields(), List.of(), true, ReasoningTemplates.duplicate(document.vendor()),
                0.0, List.of(), trail.entries(), DecisionOutcome.DUPLICATE);
    }

    private List<Memory> recall(InvoiceDocument document, AuditTrail trail) {
        List<Memory> memories = memoryStore.memoriesForVendor(document.vendor());

        Map<MemoryType, Long> breakdown = new EnumMap<>(MemoryType.class);
        for (Memory memory : memories) {
            breakdown.merge(memory.type(), 1L, Long::sum);
        }
        String breakdownText = breakdown.entrySet().stream()
                .map(e -> e.getKey().name().toLowerCase(Locale.ROOT) + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
        trail.add(PipelineStep.RECALL, "Recalled " + memories.size() + " memories for vendor \""
                + document.vendor() + "\" (breakdown: " + breakdownText + ")");

        if (memories.isEmpty()) {
            trail.add(PipelineStep.RECALL, "No prior memories found; system operating in cold-start mode");
        }

        long highConfidence = memories.stream()
                .filter(m -> m.confidence() >= options.getAutoCorrectThreshold())
                .count();
        if (highConfidence > 0) {
            trail.add(PipelineStep.RECALL, "Found " + highConfidence
                    + " high-confidence memories eligible for auto-application");
        }

        if (!memories.isEmpty()) {
            trail.add(PipelineStep.RECALL, "Recalled memory patterns: "
                    + memories.stream().map(Memory::pattern).collect(Collectors.joining(", ")));
        }
        log.debug("pipeline.recall memories={} highConfidence={}", memories.size(), highConfidence);
        return memories;
    }

    private List<ProposedCorrection> apply(InvoiceDocument document, List<Memory> memories, AuditTrail trail) {
        List<ProposedCorrection> candidates = ruleRegistry.propose(document, memories);
        List<ProposedCorrection> corrections = CorrectionDeduplicator.deduplicate(candidates);
        if (!candidates.isEmpty()) {
            trail.add(PipelineStep.APPLY, "Proposed " + corrections.size() + " correction(s) from "
                    + candidates.size() + " candidate(s): "
                    + corrections.stream().map(ProposedCorrection::field).collect(Collectors.joining(", ")));
        }
        metricsService.recordProposedCorrections(corrections.size());
        log.debug("pipeline.apply candidates={} corrections={}", candidates.size(), corrections.size());
        return corrections;
    }

    /**
     * Feeds a verdict on previously proposed corrections back into memory,
     * without running the document through the duplicate guard again.
     * Used by the review workflow once a human or evaluator has decided.
     *
     * @throws IllegalArgumentException if the verdict is {@link Verdict#NONE}
     */
    public LearningReport learn(InvoiceDocument document, List<ProposedCorrection> corrections, Verdict verdict) {
        if (!verdict.present()) {
            throw new IllegalArgumentException("A verdict is required to learn");
        }
        try (Span span = tracingService.startSpan("invoice.learn", Map.of(
                "documentId", document.documentId(),
                "vendor", document.vendor(),
                "verdict", verdict.name()))) {
            try {
                AuditTrail trail = new AuditTrail(clock);
                List<String> updates = learn(document, corrections, verdict, trail);
                span.setAttribute("memoryUpdates", updates.size());
                span.setStatus(Span.SpanStatus.OK);
                return new LearningReport(updates, trail.entries());
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    private List<String> learn(InvoiceDocument document, List<ProposedCorrection> corrections,
                               Verdict verdict, AuditTrail trail) {
        Set<String> patterns = new LinkedHashSet<>();
        for (ProposedCorrection correction : corrections) {
            patterns.add(ruleRegistry.patternFor(document.vendor(), correction.path()));
        }

        List<String> updates = new ArrayList<>();
        for (String pattern : patterns) {
            MemoryKey key = new MemoryKey(document.vendor(), pattern);
            Optional<ReinforcementPolicy.LearningResult> result =
                    lock.withLock(key.lockKey(), () -> learnPattern(document, pattern, verdict));
            if (result.isEmpty()) {
                trail.add(PipelineStep.LEARN, "No memory stored for pattern \"" + pattern + "\"; skipped");
                continue;
            }
            String line = result.get().describe();
            updates.add(line);
            trail.add(PipelineStep.LEARN, line);
        }

        trail.add(PipelineStep.LEARN, verdict == Verdict.APPROVED
                ? "Human/evaluator approval reinforced memory confidence"
                : "Human/evaluator rejection reduced memory confidence");
        return updates;
    }

    private Optional<ReinforcementPolicy.LearningResult> learnPattern(InvoiceDocument document, String pattern,
                                                                     Verdict verdict) {
        Optional<Memory> live = memoryStore.memoryByPattern(document.vendor(), pattern);
        if (live.isEmpty()) {
            log.warn("pipeline.learn.skipped pattern='{}' reason=memory-missing", pattern);
            auditService.record(AuditAction.MEMORY_MISSING, document.documentId(), AuditService.PIPELINE_ACTOR,
                    Map.of("vendor", document.vendor(), "pattern", pattern));
            return Optional.empty();
        }
        Memory memory = live.get();
        ReinforcementPolicy.LearningResult result = reinforcementPolicy.apply(memory, verdict);
        memoryStore.updateConfidenceAndCounters(memory.id(), result.newConfidence(),
                result.approvals(), result.rejections());

        boolean approved = verdict == Verdict.APPROVED;
        if (approved) {
            metricsService.incrementReinforced(pattern);
        } else {
            metricsService.incrementPenalized(pattern);
        }
        auditService.record(approved ? AuditAction.MEMORY_REINFORCED : AuditAction.MEMORY_PENALIZED,
                memory.id(), AuditService.PIPELINE_ACTOR, Map.of(
                        "documentId", document.documentId(),
                        "pattern", pattern,
                        "previousConfidence", result.previousConfidence(),
                        "newConfidence", result.newConfidence()));
        log.info("pipeline.learn pattern='{}' verdict={} confidence={} -> {}",
                pattern, verdict, format(result.previousConfidence()), format(result.newConfidence()));
        return Optional.of(result);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    public PipelineOptions getOptions() {
        return options;
    }

    public DuplicateGuard getDuplicateGuard() {
        return duplicateGuard;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MemoryStore memoryStore;
        private CorrectionRuleRegistry ruleRegistry;
        private DuplicateGuard duplicateGuard;
        private PipelineOptions options = PipelineOptions.defaults();
        private DistributedLock lock;
        private AuditService auditService;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock = Clock.systemUTC();

        public Builder memoryStore(MemoryStore memoryStore) {
            this.memoryStore = memoryStore;
            return this;
        }

        public Builder ruleRegistry(CorrectionRuleRegistry ruleRegistry) {
            this.ruleRegistry = ruleRegistry;
            return this;
        }

        /**
         * Overrides the duplicate guard. When unset, a Caffeine-backed history with
         * the window from {@link PipelineOptions} is used.
         */
        public Builder duplicateGuard(DuplicateGuard duplicateGuard) {
            this.duplicateGuard = duplicateGuard;
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        public Builder distributedLock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DecisionPipeline build() {
            if (memoryStore == null) {
                throw new IllegalStateException("MemoryStore is required");
            }
            if (ruleRegistry == null) {
                throw new IllegalStateException("CorrectionRuleRegistry is required");
            }
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(clock, "clock is required");
            return new DecisionPipeline(this);
        }
    }
}
