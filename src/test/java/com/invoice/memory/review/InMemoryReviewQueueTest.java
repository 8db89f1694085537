package com.invoice.memory.review;

import com.invoice.memory.api.Page;
import com.invoice.memory.api.PageRequest;
import com.invoice.memory.decision.DecisionOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.invoice.memory.InvoiceFixtures.NOW;
import static com.invoice.memory.InvoiceFixtures.partsInvoice;
import static com.invoice.memory.InvoiceFixtures.supplierInvoice;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryReviewQueueTest {

    private InMemoryReviewQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryReviewQueue();
    }

    private ReviewItem submit(String documentId, boolean parts, long minutesAfterNow) {
        return queue.submit(ReviewItem.builder()
                .document(parts
                        ? partsInvoice(documentId, documentId, "2024-02-10")
                        : supplierInvoice(documentId, documentId, "2024-02-05"))
                .outcome(DecisionOutcome.ESCALATED)
                .confidenceScore(0.5)
                .submittedAt(NOW.plus(Duration.ofMinutes(minutesAfterNow)))
                .build());
    }

    @Test
    void getPending_oldestFirstAndPaged() {
        submit("INV-3", false, 3);
        submit("INV-1", false, 1);
        submit("INV-2", true, 2);

        Page<ReviewItem> first = queue.getPending(PageRequest.of(0, 2));
        Page<ReviewItem> second = queue.getPending(PageRequest.of(1, 2));

        assertEquals(3, first.totalElements());
        assertEquals("INV-1", first.content().get(0).getDocumentId());
        assertEquals("INV-2", first.content().get(1).getDocumentId());
        assertTrue(first.hasNext());
        assertEquals(1, second.content().size());
        assertFalse(second.hasNext());
        assertEquals(2, first.totalPages());
    }

    @Test
    void getPendingByVendor_filters() {
        submit("INV-1", false, 1);
        submit("INV-2", true, 2);

        Page<ReviewItem> parts = queue.getPendingByVendor("Parts AG", PageRequest.first(10));

        assertEquals(1, parts.totalElements());
        assertEquals("INV-2", parts.content().get(0).getDocumentId());
    }

    @Test
    void approve_removesFromPending() {
        ReviewItem item = submit("INV-1", false, 1);

        queue.approve(item.getId(), "alice", "looks right", NOW);

        assertEquals(ReviewStatus.APPROVED, queue.get(item.getId()).getStatus());
        assertEquals("alice", queue.get(item.getId()).getReviewerId());
        assertEquals(NOW, queue.get(item.getId()).getReviewedAt());
        assertEquals(0, queue.countPending());
    }

    @Test
    void reject_twiceIsRejected() {
        ReviewItem item = submit("INV-1", false, 1);
        queue.reject(item.getId(), "bob", null, NOW);

        assertThrows(IllegalStateException.class, () -> queue.reject(item.getId(), "bob", null, NOW));
        assertThrows(IllegalStateException.class, () -> queue.approve(item.getId(), "bob", null, NOW));
    }

    @Test
    void unknownIdThrows() {
        assertNull(queue.get("missing"));
        assertThrows(IllegalArgumentException.class, () -> queue.approve("missing", "alice", null, NOW));
    }

    @Test
    void pageRequest_validates() {
        assertThrows(IllegalArgumentException.class, () -> PageRequest.of(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> PageRequest.of(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new PageRequest(0, 1001));
        assertEquals(2, PageRequest.of(2, 25).pageNumber());
    }
}
