package com.invoice.memory.core.model;

import java.math.BigDecimal;

/**
 * A single invoice position.
 */
public record LineItem(String sku, String description, BigDecimal qty, BigDecimal unitPrice) {

    public LineItem withSku(String newSku) {
        return new LineItem(newSku, description, qty, unitPrice);
    }

    Object valueOf(String field) {
        return switch (field) {
            case "sku" -> sku;
            case "description" -> description;
            case "qty" -> qty;
            case "unitPrice" -> unitPrice;
            default -> throw new IllegalArgumentException("Unknown line item field: " + field);
        };
    }

    LineItem with(String field, Object value) {
        return switch (field) {
            case "sku" -> withSku(InvoiceFields.asText(value));
            case "description" -> new LineItem(sku, InvoiceFields.asText(value), qty, unitPrice);
            case "qty" -> new LineItem(sku, description, InvoiceFields.asDecimal(value), unitPrice);
            case "unitPrice" -> new LineItem(sku, description, qty, InvoiceFields.asDecimal(value));
            default -> throw new IllegalArgumentException("Unknown line item field: " + field);
        };
    }
}
