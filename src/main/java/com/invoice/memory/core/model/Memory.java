package com.invoice.memory.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A persisted, vendor-scoped belief about a correction pattern.
 * At most one memory exists per (vendor, pattern) pair; the confidence score
 * rises with approvals, falls with rejections and erodes over time.
 *
 * <p>Instances are immutable snapshots. Stores hand out copies and accept
 * update requests through their own contract.</p>
 *
 * @param id          stable identifier
 * @param type        memory kind
 * @param vendor      vendor the pattern was learned for
 * @param pattern     pattern identifier, matched against the rule registry
 * @param confidence  trust score in [0.0, 1.0]
 * @param approvals   number of approvals recorded
 * @param rejections  number of rejections recorded
 * @param lastUpdated last reinforcement, penalty or decay write
 */
public record Memory(
        String id,
        MemoryType type,
        String vendor,
        String pattern,
        double confidence,
        int approvals,
        int rejections,
        Instant lastUpdated
) {
    public Memory {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(vendor, "vendor is required");
        Objects.requireNonNull(pattern, "pattern is required");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        if (approvals < 0) {
            throw new IllegalArgumentException("approvals must be >= 0");
        }
        if (rejections < 0) {
            throw new IllegalArgumentException("rejections must be >= 0");
        }
    }

    public MemoryKey key() {
        return new MemoryKey(vendor, pattern);
    }

    public Memory withConfidence(double newConfidence, Instant updatedAt) {
        return new Memory(id, type, vendor, pattern, newConfidence, approvals, rejections, updatedAt);
    }

    public Memory withStats(double newConfidence, int newApprovals, int newRejections, Instant updatedAt) {
        return new Memory(id, type, vendor, pattern, newConfidence, newApprovals, newRejections, updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private MemoryType type = MemoryType.CORRECTION;
        private String vendor;
        private String pattern;
        private double confidence;
        private int approvals;
        private int rejections;
        private Instant lastUpdated = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(MemoryType type) {
            this.type = type;
            return this;
        }

        public Builder vendor(String vendor) {
            this.vendor = vendor;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder approvals(int approvals) {
            this.approvals = approvals;
            return this;
        }

        public Builder rejections(int rejections) {
            this.rejections = rejections;
            return this;
        }

        public Builder lastUpdated(Instant lastUpdated) {
            this.lastUpdated = lastUpdated;
            return this;
        }

        public Memory build() {
            return new Memory(id, type, vendor, pattern, confidence, approvals, rejections, lastUpdated);
        }
    }
}
