package com.invoice.memory.core.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured business fields extracted from an invoice.
 * Immutable: {@link #with(FieldPath, Object)} returns a modified copy.
 */
public record InvoiceFields(
        String invoiceNumber,
        String invoiceDate,
        String serviceDate,
        String currency,
        String poNumber,
        String paymentTerms,
        BigDecimal netTotal,
        BigDecimal taxRate,
        BigDecimal taxTotal,
        BigDecimal grossTotal,
        List<LineItem> lineItems
) {
    public InvoiceFields {
        lineItems = lineItems != null ? List.copyOf(lineItems) : List.of();
    }

    /**
     * Reads the value addressed by {@code path}.
     *
     * @throws IllegalArgumentException if the path does not name a known field
     *                                  or the element index is out of range
     */
    public Object valueAt(FieldPath path) {
        if (path.indexed()) {
            return element(path).valueOf(path.child());
        }
        return switch (path.name()) {
            case "invoiceNumber" -> invoiceNumber;
            case "invoiceDate" -> invoiceDate;
            case "serviceDate" -> serviceDate;
            case "currency" -> currency;
            case "poNumber" -> poNumber;
            case "paymentTerms" -> paymentTerms;
            case "netTotal" -> netTotal;
            case "taxRate" -> taxRate;
            case "taxTotal" -> taxTotal;
            case "grossTotal" -> grossTotal;
            case "lineItems" -> lineItems;
            default -> throw new IllegalArgumentException("Unknown field: " + path);
        };
    }

    /**
     * Returns a copy with the addressed field replaced.
     *
     * @throws IllegalArgumentException if the path does not name a writable field
     */
    public InvoiceFields with(FieldPath path, Object value) {
        if (path.indexed()) {
            List<LineItem> items = new ArrayList<>(lineItems);
            items.set(path.index(), element(path).with(path.child(), value));
            return toBuilder().lineItems(items).build();
        }
        Builder b = toBuilder();
        switch (path.name()) {
            case "invoiceNumber" -> b.invoiceNumber(asText(value));
            case "invoiceDate" -> b.invoiceDate(asText(value));
            case "serviceDate" -> b.serviceDate(asText(value));
            case "currency" -> b.currency(asText(value));
            case "poNumber" -> b.poNumber(asText(value));
            case "paymentTerms" -> b.paymentTerms(asText(value));
            case "netTotal" -> b.netTotal(asDecimal(value));
            case "taxRate" -> b.taxRate(asDecimal(value));
            case "taxTotal" -> b.taxTotal(asDecimal(value));
            case "grossTotal" -> b.grossTotal(asDecimal(value));
            default -> throw new IllegalArgumentException("Field is not writable: " + path);
        }
        return b.build();
    }

    private LineItem element(FieldPath path) {
        if (!"lineItems".equals(path.name())) {
            throw new IllegalArgumentException("Unknown collection: " + path.name());
        }
        if (path.index() >= lineItems.size()) {
            throw new IllegalArgumentException("Line item index out of range: " + path);
        }
        return lineItems.get(path.index());
    }

    static String asText(Object value) {
        return value != null ? value.toString() : null;
    }

    static BigDecimal asDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal d) {
            return d;
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        return new BigDecimal(value.toString().trim());
    }

    public Builder toBuilder() {
        return new Builder()
                .invoiceNumber(invoiceNumber)
                .invoiceDate(invoiceDate)
                .serviceDate(serviceDate)
                .currency(currency)
                .poNumber(poNumber)
                .paymentTerms(paymentTerms)
                .netTotal(netTotal)
                .taxRate(taxRate)
                .taxTotal(taxTotal)
                .grossTotal(grossTotal)
                .lineItems(lineItems);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String invoiceNumber;
        private String invoiceDate;
        private String serviceDate;
        private String currency;
        private String poNumber;
        private String paymentTerms;
        private BigDecimal netTotal;
        private BigDecimal taxRate;
        private BigDecimal taxTotal;
        private BigDecimal grossTotal;
        private List<LineItem> lineItems;

        public Builder invoiceNumber(String invoiceNumber) {
            this.invoiceNumber = invoiceNumber;
            return this;
        }

        public Builder invoiceDate(String invoiceDate) {
            this.invoiceDate = invoiceDate;
            return this;
        }

        public Builder serviceDate(String serviceDate) {
            this.serviceDate = serviceDate;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder poNumber(String poNumber) {
            this.poNumber = poNumber;
            return this;
        }

        public Builder paymentTerms(String paymentTerms) {
            this.paymentTerms = paymentTerms;
            return this;
        }

        public Builder netTotal(BigDecimal netTotal) {
            this.netTotal = netTotal;
            return this;
        }

        public Builder taxRate(BigDecimal taxRate) {
            this.taxRate = taxRate;
            return this;
        }

        public Builder taxTotal(BigDecimal taxTotal) {
            this.taxTotal = taxTotal;
            return this;
        }

        public Builder grossTotal(BigDecimal grossTotal) {
            this.grossTotal = grossTotal;
            return this;
        }

        public Builder lineItems(List<LineItem> lineItems) {
            this.lineItems = lineItems;
            return this;
        }

        public InvoiceFields build() {
            return new InvoiceFields(invoiceNumber, invoiceDate, serviceDate, currency, poNumber,
                    paymentTerms, netTotal, taxRate, taxTotal, grossTotal, lineItems);
        }
    }
}
