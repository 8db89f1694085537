package com.invoice.memory.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldPathTest {

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Plain field name")
        void plainName() {
            FieldPath path = FieldPath.parse("serviceDate");
            assertEquals("serviceDate", path.name());
            assertFalse(path.indexed());
            assertEquals("serviceDate", path.toString());
        }

        @Test
        @DisplayName("Indexed element path")
        void indexedPath() {
            FieldPath path = FieldPath.parse("lineItems[2].sku");
            assertTrue(path.indexed());
            assertEquals(2, path.index());
            assertEquals("sku", path.child());
            assertEquals("lineItems[2].sku", path.toString());
            assertEquals("lineItems[].sku", path.template());
        }

        @Test
        @DisplayName("Template path has no index")
        void templatePath() {
            FieldPath path = FieldPath.parse("lineItems[].sku");
            assertFalse(path.indexed());
            assertEquals("lineItems[].sku", path.template());
        }

        @Test
        @DisplayName("Malformed paths are rejected")
        void malformed() {
            assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("lineItems[x].sku"));
            assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("lineItems[1]"));
            assertThrows(IllegalArgumentException.class, () -> FieldPath.parse(""));
        }
    }

    @Test
    @DisplayName("Element paths of one collection share a template")
    void sharedTemplate() {
        assertEquals(FieldPath.element("lineItems", 0, "sku").template(),
                FieldPath.element("lineItems", 7, "sku").template());
    }
}
