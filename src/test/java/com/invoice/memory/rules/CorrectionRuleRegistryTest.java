package com.invoice.memory.rules;

import com.invoice.memory.core.model.FieldPath;
import com.invoice.memory.core.model.Memory;
import com.invoice.memory.core.model.ProposedCorrection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.invoice.memory.InvoiceFixtures.freightInvoice;
import static com.invoice.memory.InvoiceFixtures.memory;
import static com.invoice.memory.rules.DefaultCorrectionRules.*;
import static org.junit.jupiter.api.Assertions.*;

class CorrectionRuleRegistryTest {

    private CorrectionRuleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = DefaultCorrectionRules.createDefaultRegistry();
    }

    @Test
    void register_rejectsSecondRuleForSamePattern() {
        CorrectionRule duplicate = CorrectionRule.builder()
                .vendor(SUPPLIER_GMBH)
                .pattern(SERVICE_DATE_PATTERN)
                .targetField("poNumber")
                .matcher(doc -> List.of())
                .build();

        assertThrows(IllegalArgumentException.class, () -> registry.register(duplicate));
    }

    @Test
    void register_rejectsSecondPatternForSameField() {
        CorrectionRule competing = CorrectionRule.builder()
                .vendor(PARTS_AG)
                .pattern("OTHER_TAX_FIX")
                .targetField("taxTotal")
                .matcher(doc -> List.of())
                .build();

        assertThrows(IllegalArgumentException.class, () -> registry.register(competing));
        assertTrue(registry.ruleFor(PARTS_AG, "OTHER_TAX_FIX").isEmpty());
    }

    @Test
    void register_sameFieldForAnotherVendorIsAllowed() {
        registry.register(CorrectionRule.builder()
                .vendor("Other Vendor")
                .pattern("SERVICE_DATE")
                .targetField("serviceDate")
                .matcher(doc -> List.of())
                .build());

        assertEquals("SERVICE_DATE", registry.patternFor("Other Vendor", FieldPath.of("serviceDate")));
        assertEquals(6, registry.size());
    }

    @Test
    void patternFor_resolvesIndexedPaths() {
        assertEquals(FREIGHT_SKU_PATTERN,
                registry.patternFor(FREIGHT_AND_CO, FieldPath.parse("lineItems[7].sku")));
    }

    @Test
    void patternFor_unknownFieldThrows() {
        assertThrows(UnknownPatternException.class,
                () -> registry.patternFor(SUPPLIER_GMBH, FieldPath.of("grossTotal")));
        assertThrows(UnknownPatternException.class,
                () -> registry.patternFor("Nobody", FieldPath.of("serviceDate")));
    }

    @Test
    void fieldFor_returnsTemplate() {
        assertEquals("lineItems[].sku",
                registry.fieldFor(FREIGHT_AND_CO, FREIGHT_SKU_PATTERN).orElseThrow().template());
        assertTrue(registry.fieldFor(FREIGHT_AND_CO, "UNKNOWN").isEmpty());
    }

    @Test
    void propose_skipsMemoriesWithoutRule() {
        Memory skonto = memory(FREIGHT_AND_CO, SKONTO_PATTERN, 0.8);
        Memory orphan = memory(FREIGHT_AND_CO, "NO_SUCH_RULE", 0.9);

        List<ProposedCorrection> result = registry.propose(
                freightInvoice("INV-C-001", "C-001", "2024-02-15"), List.of(orphan, skonto));

        assertEquals(1, result.size());
        assertEquals(skonto.id(), result.get(0).sourceMemoryId());
    }

    @Test
    void rule_rejectsChangeOutsideDeclaredField() {
        CorrectionRule misbehaving = CorrectionRule.builder()
                .vendor(FREIGHT_AND_CO)
                .pattern("BROKEN")
                .targetField("poNumber")
                .matcher(doc -> List.of(new FieldChange(FieldPath.of("currency"), null, "EUR")))
                .build();

        assertThrows(IllegalStateException.class, () -> misbehaving.apply(
                freightInvoice("INV-C-001", "C-001", "2024-02-15"), memory(FREIGHT_AND_CO, "BROKEN", 0.9)));
    }
}
