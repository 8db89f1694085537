package com.invoice.memory.review;

import com.invoice.memory.api.Page;
import com.invoice.memory.api.PageRequest;
import com.invoice.memory.audit.AuditAction;
import com.invoice.memory.audit.AuditService;
import com.invoice.memory.core.model.InvoiceDocument;
import com.invoice.memory.core.model.OutputContract;
import com.invoice.memory.core.model.Verdict;
import com.invoice.memory.evaluation.Evaluation;
import com.invoice.memory.evaluation.GroundTruthEvaluator;
import com.invoice.memory.logging.LogContext;
import com.invoice.memory.pipeline.DecisionPipeline;
import com.invoice.memory.pipeline.LearningReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Coordinates the review queue with the learn stage of the pipeline.
 * A verdict on a review item reinforces or penalizes the memories behind the
 * corrections it holds, then marks the item.
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    public static final String EVALUATOR_REVIEWER = "evaluator";

    private final ReviewQueue reviewQueue;
    private final DecisionPipeline pipeline;
    private final AuditService auditService;
    private final Clock clock;

    public ReviewService(ReviewQueue reviewQueue, DecisionPipeline pipeline, AuditService auditService) {
        this(reviewQueue, pipeline, auditService, Clock.systemUTC());
    }

    public ReviewService(ReviewQueue reviewQueue, DecisionPipeline pipeline, AuditService auditService,
                         Clock clock) {
        this.reviewQueue = reviewQueue;
        this.pipeline = pipeline;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Queues a processed document for review.
     */
    public ReviewItem submitForReview(InvoiceDocument document, OutputContract result) {
        ReviewItem submitted = reviewQueue.submit(ReviewItem.builder()
                .document(document)
                .corrections(result.proposedCorrections())
                .confidenceScore(result.confidenceScore())
                .outcome(result.decision())
                .reasoning(result.reasoning())
                .submittedAt(clock.instant())
                .build());

        auditService.record(AuditAction.REVIEW_SUBMITTED, document.documentId(), AuditService.PIPELINE_ACTOR,
                Map.of(
                        "reviewItemId", submitted.getId(),
                        "outcome", result.decision().name(),
                        "confidenceScore", result.confidenceScore()
                ));
        log.info("review.submitted reviewItemId={} documentId={} outcome={} confidence={}",
                submitted.getId(), document.documentId(), result.decision(), result.confidenceScore());
        return submitted;
    }

    /**
     * Approves an item and reinforces the memories behind its corrections.
     */
    public LearningReport approve(String reviewId, String reviewerId, String notes) {
        return decide(reviewId, reviewerId, notes, Verdict.APPROVED);
    }

    /**
     * Rejects an item and penalizes the memories behind its corrections.
     */
    public LearningReport reject(String reviewId, String reviewerId, String notes) {
        return decide(reviewId, reviewerId, notes, Verdict.REJECTED);
    }

    /**
     * Asks a ground-truth evaluator for the verdict and applies it.
     */
    public LearningReport resolveWith(String reviewId, GroundTruthEvaluator evaluator) {
        ReviewItem item = pendingItem(reviewId);
        Evaluation evaluation = evaluator.evaluate(item.getDocument());
        log.debug("review.evaluated reviewItemId={} status={} reason='{}'",
                reviewId, evaluation.status(), evaluation.reason());
        return decide(reviewId, EVALUATOR_REVIEWER, evaluation.reason(), evaluation.toVerdict());
    }

    private LearningReport decide(String reviewId, String reviewerId, String notes, Verdict verdict) {
        try (LogContext ctx = LogContext.forReview(LogContext.generateCorrelationId(), reviewId, verdict.name())) {
            ReviewItem item = pendingItem(reviewId);

            // the item stays pending until learning succeeds so a failed verdict can be retried
            LearningReport report = pipeline.learn(item.getDocument(), item.getCorrections(), verdict);

            if (verdict == Verdict.APPROVED) {
                reviewQueue.approve(reviewId, reviewerId, notes, clock.instant());
            } else {
                reviewQueue.reject(reviewId, reviewerId, notes, clock.instant());
            }

            auditService.record(AuditAction.REVIEW_COMPLETED, item.getDocumentId(), reviewerId, Map.of(
                    "reviewItemId", reviewId,
                    "decision", verdict.name(),
                    "memoryUpdates", report.memoryUpdates().size(),
                    "notes", notes != null ? notes : ""
            ));
            log.info("review.completed reviewItemId={} decision={} memoryUpdates={}",
                    reviewId, verdict, report.memoryUpdates().size());
            return report;
        }
    }

    private ReviewItem pendingItem(String reviewId) {
        ReviewItem item = reviewQueue.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }

    public Page<ReviewItem> getPendingReviews(PageRequest page) {
        return reviewQueue.getPending(page);
    }

    public Page<ReviewItem> getPendingReviewsByVendor(String vendor, PageRequest page) {
        return reviewQueue.getPendingByVendor(vendor, page);
    }

    public ReviewItem getReviewItem(String reviewId) {
        return reviewQueue.get(reviewId);
    }

    public long getPendingCount() {
        return reviewQueue.countPending();
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }
}
