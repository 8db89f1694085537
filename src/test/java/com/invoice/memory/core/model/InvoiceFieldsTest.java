package com.invoice.memory.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InvoiceFieldsTest {

    private final InvoiceFields fields = InvoiceFields.builder()
            .invoiceNumber("INV-1")
            .netTotal(new BigDecimal("100.00"))
            .lineItems(List.of(
                    new LineItem(null, "Shipping", BigDecimal.ONE, BigDecimal.TEN),
                    new LineItem("A-1", "Widget", BigDecimal.ONE, BigDecimal.TEN)))
            .build();

    @Test
    @DisplayName("with() returns a copy and leaves the original untouched")
    void withReturnsCopy() {
        InvoiceFields updated = fields.with(FieldPath.of("serviceDate"), "2024-02-01");

        assertEquals("2024-02-01", updated.serviceDate());
        assertNull(fields.serviceDate());
        assertEquals("INV-1", updated.invoiceNumber());
    }

    @Test
    @DisplayName("Indexed writes only touch the addressed line item")
    void indexedWrite() {
        InvoiceFields updated = fields.with(FieldPath.parse("lineItems[0].sku"), "FREIGHT");

        assertEquals("FREIGHT", updated.lineItems().get(0).sku());
        assertEquals("A-1", updated.lineItems().get(1).sku());
        assertNull(fields.lineItems().get(0).sku());
    }

    @Test
    @DisplayName("Numeric fields accept numbers and numeric strings")
    void numericCoercion() {
        assertEquals(new BigDecimal("19.00"), fields.with(FieldPath.of("taxTotal"), new BigDecimal("19.00")).taxTotal());
        assertEquals(new BigDecimal("19.5"), fields.with(FieldPath.of("taxTotal"), "19.5").taxTotal());
    }

    @Test
    @DisplayName("valueAt reads plain and indexed fields")
    void valueAt() {
        assertEquals("INV-1", fields.valueAt(FieldPath.of("invoiceNumber")));
        assertEquals("A-1", fields.valueAt(FieldPath.parse("lineItems[1].sku")));
    }

    @Test
    @DisplayName("Unknown fields and out-of-range items are rejected")
    void unknownFields() {
        assertThrows(IllegalArgumentException.class, () -> fields.with(FieldPath.of("vendorName"), "x"));
        assertThrows(IllegalArgumentException.class, () -> fields.valueAt(FieldPath.parse("lineItems[5].sku")));
    }

    @Test
    @DisplayName("Line items are immutable")
    void lineItemsImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> fields.lineItems().add(null));
    }
}
