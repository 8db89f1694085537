package com.invoice.memory.history;

import com.invoice.memory.core.model.InvoiceDocument;
import com.invoice.memory.core.model.InvoiceFields;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.invoice.memory.InvoiceFixtures.supplierInvoice;
import static org.junit.jupiter.api.Assertions.*;

class DuplicateGuardTest {

    private DuplicateGuard guard;

    @BeforeEach
    void setUp() {
        guard = new DuplicateGuard(new CaffeineDocumentHistory());
        guard.remember(supplierInvoice("INV-A-001", "A-001", "2024-02-05"));
    }

    @Nested
    @DisplayName("Date window")
    class DateWindow {

        @ParameterizedTest(name = "{0} is a duplicate of 2024-02-05: {1}")
        @CsvSource({
                "2024-02-05, true",
                "2024-02-06, true",
                "2024-02-07, true",
                "2024-02-03, true",
                "2024-02-08, false",
                "2024-02-02, false"
        })
        void window(String invoiceDate, boolean duplicate) {
            InvoiceDocument candidate = supplierInvoice("INV-A-009", "A-001", invoiceDate);
            assertEquals(duplicate, guard.findDuplicate(candidate).isPresent());
        }

        @Test
        @DisplayName("German dates are compared with ISO dates")
        void germanFormat() {
            InvoiceDocument candidate = supplierInvoice("INV-A-009", "A-001", "06.02.2024");
            assertEquals("INV-A-001", guard.findDuplicate(candidate).orElseThrow().documentId());
        }

        @Test
        @DisplayName("Timestamps are compared by their date part")
        void timestamp() {
            InvoiceDocument candidate = supplierInvoice("INV-A-009", "A-001", "2024-02-06T23:59:00");
            assertTrue(guard.findDuplicate(candidate).isPresent());
        }
    }

    @Nested
    @DisplayName("Never a duplicate")
    class NeverDuplicate {

        @Test
        @DisplayName("Different invoice number")
        void otherNumber() {
            assertTrue(guard.findDuplicate(supplierInvoice("INV-A-009", "A-002", "2024-02-05")).isEmpty());
        }

        @Test
        @DisplayName("Different vendor")
        void otherVendor() {
            InvoiceDocument candidate = new InvoiceDocument("INV-X-1", "Parts AG",
                    InvoiceFields.builder().invoiceNumber("A-001").invoiceDate("2024-02-05").build(), "", 0.9);
            assertTrue(guard.findDuplicate(candidate).isEmpty());
        }

        @Test
        @DisplayName("Unparsable issue date")
        void unparsableDate() {
            assertTrue(guard.findDuplicate(supplierInvoice("INV-A-009", "A-001", "early February")).isEmpty());
        }

        @Test
        @DisplayName("Missing issue date")
        void missingDate() {
            assertTrue(guard.findDuplicate(supplierInvoice("INV-A-009", "A-001", null)).isEmpty());
        }

        @Test
        @DisplayName("Previous document with an unparsable date")
        void previousUnparsable() {
            guard.getHistory().clear();
            guard.remember(supplierInvoice("INV-A-001", "A-001", "02/05/2024"));
            assertTrue(guard.findDuplicate(supplierInvoice("INV-A-009", "A-001", "2024-02-05")).isEmpty());
        }
    }

    @Test
    void negativeWindowRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DuplicateGuard(new CaffeineDocumentHistory(), -1));
    }

    @Test
    void customWindow() {
        DuplicateGuard wide = new DuplicateGuard(guard.getHistory(), 5);
        assertTrue(wide.findDuplicate(supplierInvoice("INV-A-009", "A-001", "2024-02-10")).isPresent());
        assertEquals(5, wide.getWindowDays());
    }
}
