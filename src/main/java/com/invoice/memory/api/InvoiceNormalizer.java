package com.invoice.memory.api;

import com.invoice.memory.audit.AuditService;
import com.invoice.memory.core.model.InvoiceDocument;
import com.invoice.memory.core.model.OutputContract;
import com.invoice.memory.core.model.Verdict;
import com.invoice.memory.decision.ConfidenceDecayEngine;
import com.invoice.memory.decision.DecisionOutcome;
import com.invoice.memory.graph.FalkorDBConnection;
import com.invoice.memory.graph.GraphConnection;
import com.invoice.memory.history.CaffeineDocumentHistory;
import com.invoice.memory.history.DocumentHistory;
import com.invoice.memory.history.DuplicateGuard;
import com.invoice.memory.history.HistoryConfig;
import com.invoice.memory.lock.DistributedLock;
import com.invoice.memory.lock.LocalDistributedLock;
import com.invoice.memory.memory.GraphMemoryStore;
import com.invoice.memory.memory.InMemoryMemoryStore;
import com.invoice.memory.memory.MemoryStore;
import com.invoice.memory.metrics.MetricsService;
import com.invoice.memory.metrics.NoOpMetricsService;
import com.invoice.memory.pipeline.DecisionPipeline;
import com.invoice.memory.review.InMemoryReviewQueue;
import com.invoice.memory.review.ReviewItem;
import com.invoice.memory.review.ReviewQueue;
import com.invoice.memory.review.ReviewService;
import com.invoice.memory.rules.CorrectionRuleRegistry;
import com.invoice.memory.rules.DefaultCorrectionRules;
import com.invoice.memory.tracing.NoOpTracingService;
import com.invoice.memory.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Main entry point of the invoice memory library.
 *
 * <p>Wires the decision pipeline, the memory store, the duplicate history and
 * the review workflow. Documents that end up escalated or flagged as
 * duplicates are queued for review automatically by {@link #normalize}.</p>
 *
 * <pre>
 * InvoiceNormalizer normalizer = InvoiceNormalizer.builder()
 *     .falkorDB("localhost", 6379, "invoice-memory")
 *     .build();
 *
 * OutputContract result = normalizer.normalize(document);
 * if (result.requiresHumanReview()) {
 *     normalizer.getReviewService().getPendingReviews(PageRequest.first(20));
 * }
 * </pre>
 */
public class InvoiceNormalizer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InvoiceNormalizer.class);

    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final MemoryStore memoryStore;
    private final DecisionPipeline pipeline;
    private final ReviewService reviewService;
    private final MetricsService metricsService;

    private InvoiceNormalizer(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;

        ConfidenceDecayEngine decayEngine = builder.decayEngine != null
                ? builder.decayEngine : new ConfidenceDecayEngine();

        if (builder.memoryStore != null) {
            this.memoryStore = builder.memoryStore;
        } else if (connection != null) {
            this.memoryStore = new GraphMemoryStore(connection, decayEngine, builder.clock);
        } else {
            this.memoryStore = new InMemoryMemoryStore(decayEngine, builder.clock);
        }

        CorrectionRuleRegistry registry = builder.ruleRegistry != null
                ? builder.ruleRegistry : DefaultCorrectionRules.createDefaultRegistry();

        DocumentHistory history = builder.documentHistory != null
                ? builder.documentHistory : new CaffeineDocumentHistory(builder.historyConfig, builder.clock);

        AuditService auditService = builder.auditService != null
                ? builder.auditService : new AuditService(builder.clock);
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        DistributedLock lock = builder.distributedLock != null
                ? builder.distributedLock : new LocalDistributedLock();

        this.pipeline = DecisionPipeline.builder()
                .memoryStore(memoryStore)
                .ruleRegistry(registry)
                .duplicateGuard(new DuplicateGuard(history, builder.options.getDuplicateWindowDays()))
                .options(builder.options)
                .distributedLock(lock)
                .auditService(auditService)
                .metricsService(metricsService)
                .tracingService(tracingService)
                .clock(builder.clock)
                .build();

        ReviewQueue reviewQueue = builder.reviewQueue != null
                ? builder.reviewQueue : new InMemoryReviewQueue();
        this.reviewService = new ReviewService(reviewQueue, pipeline, auditService, builder.clock);

        log.info("InvoiceNormalizer initialized: store={}, rules={}, options={}",
                memoryStore.getClass().getSimpleName(), registry.size(), builder.options);
    }

    /**
     * Normalizes a document without feedback and queues it for review when it
     * was escalated or flagged as a duplicate.
     */
    public OutputContract normalize(InvoiceDocument document) {
        OutputContract result = pipeline.process(document, Verdict.NONE);
        if (needsReview(result)) {
            reviewService.submitForReview(document, result);
        }
        return result;
    }

    /**
     * Normalizes a document with an immediate verdict. Nothing is queued: the
     * verdict has already been learned from.
     */
    public OutputContract normalize(InvoiceDocument document, Verdict verdict) {
        if (!verdict.present()) {
            return normalize(document);
        }
        return pipeline.process(document, verdict);
    }

    /**
     * Normalizes a document and queues it for review when needed.
     *
     * @return the queued review item, or null if the document did not need review
     */
    public ReviewItem normalizeForReview(InvoiceDocument document) {
        OutputContract result = pipeline.process(document, Verdict.NONE);
        return needsReview(result) ? reviewService.submitForReview(document, result) : null;
    }

    private static boolean needsReview(OutputContract result) {
        return result.decision() == DecisionOutcome.ESCALATED || result.decision() == DecisionOutcome.DUPLICATE;
    }

    public MemoryStore getMemoryStore() {
        return memoryStore;
    }

    public DecisionPipeline getPipeline() {
        return pipeline;
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    @Override
    public void close() {
        if (ownsConnection && connection != null) {
            connection.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private MemoryStore memoryStore;
        private ConfidenceDecayEngine decayEngine;
        private CorrectionRuleRegistry ruleRegistry;
        private DocumentHistory documentHistory;
        private HistoryConfig historyConfig = HistoryConfig.defaults();
        private PipelineOptions options = PipelineOptions.defaults();
        private DistributedLock distributedLock;
        private AuditService auditService;
        private MetricsService metricsService;
        private TracingService tracingService;
        private ReviewQueue reviewQueue;
        private Clock clock = Clock.systemUTC();

        /**
         * Stores memories in the given graph. The caller keeps ownership of the connection.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Opens a FalkorDB connection that is closed with the normalizer.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        /**
         * Uses an explicit memory store. Takes precedence over a graph connection.
         */
        public Builder memoryStore(MemoryStore memoryStore) {
            this.memoryStore = memoryStore;
            return this;
        }

        public Builder decayEngine(ConfidenceDecayEngine decayEngine) {
            this.decayEngine = decayEngine;
            return this;
        }

        public Builder ruleRegistry(CorrectionRuleRegistry ruleRegistry) {
            this.ruleRegistry = ruleRegistry;
            return this;
        }

        public Builder documentHistory(DocumentHistory documentHistory) {
            this.documentHistory = documentHistory;
            return this;
        }

        public Builder historyConfig(HistoryConfig historyConfig) {
            this.historyConfig = historyConfig;
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        public Builder distributedLock(DistributedLock distributedLock) {
            this.distributedLock = distributedLock;
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

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public InvoiceNormalizer build() {
            if (options == null) {
                throw new IllegalStateException("PipelineOptions is required");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            return new InvoiceNormalizer(this);
        }
    }
}
