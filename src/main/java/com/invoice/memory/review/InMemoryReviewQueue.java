package com.invoice.memory.review;

import com.invoice.memory.api.Page;
import com.invoice.memory.api.PageRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * In-memory {@link ReviewQueue}. Suitable for testing and single-JVM deployments.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        items.put(item.getId(), item);
        log.debug("Submitted review item {} (document={}, outcome={}, confidence={})",
                item.getId(), item.getDocumentId(), item.getOutcome(), item.getConfidenceScore());
        return item;
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        return pending(item -> true, page);
    }

    @Override
    public Page<ReviewItem> getPendingByVendor(String vendor, PageRequest page) {
        return pending(item -> vendor.equals(item.getVendor()), page);
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes, Instant at) {
        pendingItem(reviewId).markApproved(reviewerId, notes, at);
        log.info("Review item {} approved by {}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes, Instant at) {
        pendingItem(reviewId).markRejected(reviewerId, notes, at);
        log.info("Review item {} rejected by {}", reviewId, reviewerId);
    }

    @Override
    public ReviewItem get(String reviewId) {
        return items.get(reviewId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private ReviewItem pendingItem(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }

    private Page<ReviewItem> pending(Predicate<ReviewItem> filter, PageRequest page) {
        List<ReviewItem> all = items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(filter)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt).thenComparing(ReviewItem::getId))
                .toList();
        int total = all.size();
        int fromIndex = Math.min(page.offset(), total);
        int toIndex = Math.min(page.offset() + page.limit(), total);
        return new Page<>(all.subList(fromIndex, toIndex), total, page.pageNumber(), page.limit());
    }
}
