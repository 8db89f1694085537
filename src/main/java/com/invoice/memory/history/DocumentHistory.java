package com.invoice.memory.history;

import com.invoice.memory.core.model.InvoiceDocument;

import java.util.List;

/**
 * Record of documents already processed, consulted by the {@link DuplicateGuard}.
 */
public interface DocumentHistory {

    /**
     * Remembers a processed document.
     */
    void record(InvoiceDocument document);

    /**
     * Previously processed documents of a vendor carrying the given invoice number.
     */
    List<InvoiceDocument> findByInvoiceNumber(String vendor, String invoiceNumber);

    /**
     * Number of documents currently retained.
     */
    long size();

    /**
     * Forgets every document.
     */
    void clear();
}
