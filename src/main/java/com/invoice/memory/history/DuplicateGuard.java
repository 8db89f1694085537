package com.invoice.memory.history;

import com.invoice.memory.core.model.InvoiceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Flags documents that look like a resubmission of something already processed:
 * same vendor, same invoice number, and issue dates no more than
 * {@code windowDays} apart. Documents with a missing or unreadable issue date
 * never match.
 */
public class DuplicateGuard {
    private static final Logger log = LoggerFactory.getLogger(DuplicateGuard.class);

    public static final int DEFAULT_WINDOW_DAYS = 2;

    private final DocumentHistory history;
    private final int windowDays;

    public DuplicateGuard(DocumentHistory history) {
        this(history, DEFAULT_WINDOW_DAYS);
    }

    public DuplicateGuard(DocumentHistory history, int windowDays) {
        if (windowDays < 0) {
            throw new IllegalArgumentException("windowDays must be >= 0");
        }
        this.history = Objects.requireNonNull(history, "history is required");
        this.windowDays = windowDays;
    }

    /**
     * Finds a previously processed document the given one duplicates.
     */
    public Optional<InvoiceDocument> findDuplicate(InvoiceDocument document) {
        Optional<LocalDate> issued = IssueDates.parse(document.fields().invoiceDate());
        if (issued.isEmpty()) {
            return Optional.empty();
        }
        return history.findByInvoiceNumber(document.vendor(), document.fields().invoiceNumber()).stream()
                .filter(previous -> withinWindow(issued.get(), previous))
                .findFirst()
                .map(previous -> {
                    log.debug("duplicate.detected documentId={} previousId={} invoiceNumber={}",
                            document.documentId(), previous.documentId(), document.fields().invoiceNumber());
                    return previous;
                });
    }

    /**
     * Remembers a processed document for future checks.
     */
    public void remember(InvoiceDocument document) {
        history.record(document);
    }

    private boolean withinWindow(LocalDate issued, InvoiceDocument previous) {
        return IssueDates.parse(previous.fields().invoiceDate())
                .map(other -> Math.abs(ChronoUnit.DAYS.between(other, issued)) <= windowDays)
                .orElse(false);
    }

    public int getWindowDays() {
        return windowDays;
    }

    public DocumentHistory getHistory() {
        return history;
    }
}
