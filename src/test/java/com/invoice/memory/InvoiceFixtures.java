package com.invoice.memory;

import com.invoice.memory.core.model.InvoiceDocument;
import com.invoice.memory.core.model.InvoiceFields;
import com.invoice.memory.core.model.LineItem;
import com.invoice.memory.core.model.Memory;
import com.invoice.memory.core.model.MemoryType;
import com.invoice.memory.rules.DefaultCorrectionRules;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Shared documents, memories and clock for tests.
 */
public final class InvoiceFixtures {

    public static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private InvoiceFixtures() {
    }

    public static Memory memory(String vendor, String pattern, double confidence) {
        return Memory.builder()
                .vendor(vendor)
                .pattern(pattern)
                .type(MemoryType.CORRECTION)
                .confidence(confidence)
                .lastUpdated(NOW)
                .build();
    }

    /**
     * Supplier GmbH invoice missing its service date, with a Leistungsdatum line in the text.
     */
    public static InvoiceDocument supplierInvoice(String documentId, String invoiceNumber, String invoiceDate) {
        return new InvoiceDocument(documentId, DefaultCorrectionRules.SUPPLIER_GMBH,
                InvoiceFields.builder()
                        .invoiceNumber(invoiceNumber)
                        .invoiceDate(invoiceDate)
                        .currency("EUR")
                        .netTotal(new BigDecimal("2500.00"))
                        .taxRate(new BigDecimal("0.19"))
                        .taxTotal(new BigDecimal("475.00"))
                        .grossTotal(new BigDecimal("2975.00"))
                        .build(),
                "Rechnung " + invoiceNumber + "\nLeistungsdatum: 01.02.2024\nBestellnr: PO-A-050",
                0.78);
    }

    /**
     * Parts AG invoice quoting VAT-inclusive prices with the currency lost by extraction.
     */
    public static InvoiceDocument partsInvoice(String documentId, String invoiceNumber, String invoiceDate) {
        return new InvoiceDocument(documentId, DefaultCorrectionRules.PARTS_AG,
                InvoiceFields.builder()
                        .invoiceNumber(invoiceNumber)
                        .invoiceDate(invoiceDate)
                        .netTotal(new BigDecimal("2000.00"))
                        .taxRate(new BigDecimal("0.19"))
                        .taxTotal(new BigDecimal("0.00"))
                        .grossTotal(new BigDecimal("2380.00"))
                        .build(),
                "Invoice " + invoiceNumber + "\nPrices incl. VAT (MwSt. inkl.)\nTotal: 2380.00 EUR",
                0.74);
    }

    /**
     * Freight &amp; Co invoice with two shipping lines lacking a SKU and Skonto terms in the text.
     */
    public static InvoiceDocument freightInvoice(String documentId, String invoiceNumber, String invoiceDate) {
        return new InvoiceDocument(documentId, DefaultCorrectionRules.FREIGHT_AND_CO,
                InvoiceFields.builder()
                        .invoiceNumber(invoiceNumber)
                        .invoiceDate(invoiceDate)
                        .currency("EUR")
                        .netTotal(new BigDecimal("1500.00"))
                        .grossTotal(new BigDecimal("1785.00"))
                        .lineItems(List.of(
                                new LineItem(null, "Seefracht Hamburg - Rotterdam", BigDecimal.ONE,
                                        new BigDecimal("1000.00")),
                                new LineItem("PKG-01", "Packaging", BigDecimal.ONE, new BigDecimal("100.00")),
                                new LineItem(null, "Shipping surcharge", BigDecimal.ONE, new BigDecimal("400.00"))))
                        .build(),
                "Invoice " + invoiceNumber + "\n2% Skonto if paid within 10 days",
                0.8);
    }

    public static InvoiceDocument unknownVendorInvoice(String documentId) {
        return new InvoiceDocument(documentId, "Unknown Vendor Ltd",
                InvoiceFields.builder().invoiceNumber("X-1").invoiceDate("2024-02-01").build(),
                "Plain invoice", 0.9);
    }
}
