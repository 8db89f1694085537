package com.invoice.memory.review;

import com.invoice.memory.api.Page;
import com.invoice.memory.api.PageRequest;

import java.time.Instant;

/**
 * Queue of documents awaiting a verdict.
 */
public interface ReviewQueue {

    /**
     * Adds an item to the queue.
     */
    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest first.
     */
    Page<ReviewItem> getPending(PageRequest page);

    /**
     * Pending items of one vendor, oldest first.
     */
    Page<ReviewItem> getPendingByVendor(String vendor, PageRequest page);

    /**
     * Marks an item approved.
     *
     * @throws IllegalArgumentException if no item has the id
     * @throws IllegalStateException    if the item is no longer pending
     */
    void approve(String reviewId, String reviewerId, String notes, Instant at);

    /**
     * Marks an item rejected.
     *
     * @throws IllegalArgumentException if no item has the id
     * @throws IllegalStateException    if the item is no longer pending
     */
    void reject(String reviewId, String reviewerId, String notes, Instant at);

    /**
     * @return the item, or null if not found
     */
    ReviewItem get(String reviewId);

    long countPending();
}
