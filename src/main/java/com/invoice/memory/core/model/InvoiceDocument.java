package com.invoice.memory.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.Objects;

/**
 * An invoice as received from extraction. Never mutated by the pipeline;
 * normalization produces a new {@link InvoiceFields} copy instead.
 *
 * @param documentId unique document identifier
 * @param vendor     vendor name, used to scope memory recall
 * @param fields     extracted business fields
 * @param rawText    full OCR/extraction text, scanned by content predicates
 * @param confidence extraction confidence reported upstream
 */
public record InvoiceDocument(
        @JsonAlias("invoiceId") String documentId,
        String vendor,
        InvoiceFields fields,
        String rawText,
        double confidence
) {
    public InvoiceDocument {
        Objects.requireNonNull(documentId, "documentId is required");
        Objects.requireNonNull(vendor, "vendor is required");
        fields = fields != null ? fields : InvoiceFields.builder().build();
        rawText = rawText != null ? rawText : "";
    }

    public InvoiceDocument withFields(InvoiceFields newFields) {
        return new InvoiceDocument(documentId, vendor, newFields, rawText, confidence);
    }
}
