package com.invoice.memory.review;

/**
 * Status of an escalated document in the review queue.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
