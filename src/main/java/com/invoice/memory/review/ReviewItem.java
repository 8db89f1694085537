package com.invoice.memory.review;

import com.invoice.memory.core.model.InvoiceDocument;
import com.invoice.memory.core.model.ProposedCorrection;
import com.invoice.memory.decision.DecisionOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An escalated or duplicate document waiting for a human or evaluator verdict.
 * Holds the corrections the pipeline proposed so the verdict can be fed back
 * into memory without reprocessing the document.
 */
public class ReviewItem {

    private final String id;
    private final InvoiceDocument document;
    private final List<ProposedCorrection> corrections;
    private final double confidenceScore;
    private final DecisionOutcome outcome;
    private final String reasoning;
    private ReviewStatus status;
    private final Instant submittedAt;
    private Instant reviewedAt;
    private String reviewerId;
    private String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.document = Objects.requireNonNull(builder.document, "document is required");
        this.corrections = builder.corrections != null ? List.copyOf(builder.corrections) : List.of();
        this.confidenceScore = builder.confidenceScore;
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome is required");
        this.reasoning = builder.reasoning;
        this.status = builder.status != null ? builder.status : ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public InvoiceDocument getDocument() {
        return document;
    }

    public String getDocumentId() {
        return document.documentId();
    }

    public String getVendor() {
        return document.vendor();
    }

    public List<ProposedCorrection> getCorrections() {
        return corrections;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public DecisionOutcome getOutcome() {
        return outcome;
    }

    public String getReasoning() {
        return reasoning;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    void markApproved(String reviewerId, String notes, Instant at) {
        this.status = ReviewStatus.APPROVED;
        this.reviewedAt = at;
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    void markRejected(String reviewerId, String notes, Instant at) {
        this.status = ReviewStatus.REJECTED;
        this.reviewedAt = at;
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", documentId='" + document.documentId() + '\'' +
                ", vendor='" + document.vendor() + '\'' +
                ", outcome=" + outcome +
                ", confidence=" + confidenceScore +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private InvoiceDocument document;
        private List<ProposedCorrection> corrections;
        private double confidenceScore;
        private DecisionOutcome outcome;
        private String reasoning;
        private ReviewStatus status;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder document(InvoiceDocument document) {
            this.document = document;
            return this;
        }

        public Builder corrections(List<ProposedCorrection> corrections) {
            this.corrections = corrections;
            return this;
        }

        public Builder confidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder outcome(DecisionOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder status(ReviewStatus status) {
            this.status = status;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
