package com.invoice.memory.rules;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTextTest {

    @Test
    void firstDate_takesFirstToken() {
        assertEquals(Optional.of("2024-01-15"),
                DocumentText.firstDate("Leistungsdatum: 15.01.2024, Rechnungsdatum 20.01.2024"));
    }

    @Test
    void firstDate_emptyWithoutToken() {
        assertTrue(DocumentText.firstDate("Leistungsdatum: Januar").isEmpty());
        assertTrue(DocumentText.firstDate(null).isEmpty());
    }

    @Test
    void containsAny_ignoresCase() {
        assertTrue(DocumentText.containsAny("MwSt. INKL.", "inkl"));
        assertFalse(DocumentText.containsAny("net prices", "inkl", "incl"));
        assertFalse(DocumentText.containsAny(null, "inkl"));
    }

    @Test
    void taxFromTotals_roundsHalfUp() {
        assertEquals(new BigDecimal("380.00"),
                DocumentText.taxFromTotals(new BigDecimal("2380"), new BigDecimal("2000")));
        assertEquals(new BigDecimal("0.01"),
                DocumentText.taxFromTotals(new BigDecimal("10.005"), new BigDecimal("10")));
    }
}
