package com.invoice.memory.rules;

import com.invoice.memory.core.model.FieldPath;
import com.invoice.memory.core.model.InvoiceFields;
import com.invoice.memory.core.model.LineItem;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in correction rules for the known vendors.
 */
public final class DefaultCorrectionRules {

    public static final String SUPPLIER_GMBH = "Supplier GmbH";
    public static final String PARTS_AG = "Parts AG";
    public static final String FREIGHT_AND_CO = "Freight & Co";

    public static final String SERVICE_DATE_PATTERN = "Leistungsdatum -> serviceDate";
    public static final String VAT_INCLUSIVE_PATTERN = "VAT_INCLUSIVE_PRICING";
    public static final String CURRENCY_RECOVERY_PATTERN = "CURRENCY_RECOVERY";
    public static final String SKONTO_PATTERN = "SKONTO_TERMS";
    public static final String FREIGHT_SKU_PATTERN = "FREIGHT_SKU_MAPPING";

    public static final String SKONTO_DETECTED = "SKONTO_DETECTED";
    public static final String FREIGHT_SKU = "FREIGHT";

    // checked in insertion order; the first hit wins
    private static final Map<String, String> CURRENCY_MARKERS = new LinkedHashMap<>();

    static {
        CURRENCY_MARKERS.put("€", "EUR");
        CURRENCY_MARKERS.put("eur", "EUR");
        CURRENCY_MARKERS.put("£", "GBP");
        CURRENCY_MARKERS.put("gbp", "GBP");
        CURRENCY_MARKERS.put("chf", "CHF");
        CURRENCY_MARKERS.put("$", "USD");
        CURRENCY_MARKERS.put("usd", "USD");
    }

    private DefaultCorrectionRules() {
        // Utility class
    }

    /**
     * Creates a registry holding all default rules.
     */
    public static CorrectionRuleRegistry createDefaultRegistry() {
        return new CorrectionRuleRegistry(getRules());
    }

    public static List<CorrectionRule> getRules() {
        return List.of(serviceDateRule(), vatInclusiveRule(), currencyRecoveryRule(),
                skontoRule(), freightSkuRule());
    }

    /**
     * Supplier GmbH prints the service date as "Leistungsdatum" which extraction misses.
     */
    public static CorrectionRule serviceDateRule() {
        return CorrectionRule.builder()
                .name("supplier-service-date")
                .vendor(SUPPLIER_GMBH)
                .pattern(SERVICE_DATE_PATTERN)
                .targetField("serviceDate")
                .matcher(document -> {
                    InvoiceFields fields = document.fields();
                    if (!DocumentText.isBlank(fields.serviceDate())
                            || !document.rawText().contains("Leistungsdatum")) {
                        return List.of();
                    }
                    return DocumentText.firstDate(document.rawText())
                            .map(date -> List.of(new FieldChange(FieldPath.of("serviceDate"),
                                    fields.serviceDate(), date)))
                            .orElse(List.of());
                })
                .build();
    }

    /**
     * Parts AG quotes VAT-inclusive prices, so the extracted tax total is wrong.
     */
    public static CorrectionRule vatInclusiveRule() {
        return CorrectionRule.builder()
                .name("parts-vat-inclusive")
                .vendor(PARTS_AG)
                .pattern(VAT_INCLUSIVE_PATTERN)
                .targetField("taxTotal")
                .matcher(document -> {
                    InvoiceFields fields = document.fields();
                    if (fields.grossTotal() == null || fields.netTotal() == null
                            || !DocumentText.containsAny(document.rawText(), "mwst. inkl", "prices incl", "inkl")) {
                        return List.of();
                    }
                    BigDecimal recomputed = DocumentText.taxFromTotals(fields.grossTotal(), fields.netTotal());
                    return List.of(new FieldChange(FieldPath.of("taxTotal"), fields.taxTotal(), recomputed));
                })
                .build();
    }

    /**
     * Parts AG invoices often lose the currency field; the symbol survives in the text.
     */
    public static CorrectionRule currencyRecoveryRule() {
        return CorrectionRule.builder()
                .name("parts-currency-recovery")
                .vendor(PARTS_AG)
                .pattern(CURRENCY_RECOVERY_PATTERN)
                .targetField("currency")
                .matcher(document -> {
                    InvoiceFields fields = document.fields();
                    if (!DocumentText.isBlank(fields.currency())) {
                        return List.of();
                    }
                    for (Map.Entry<String, String> marker : CURRENCY_MARKERS.entrySet()) {
                        if (DocumentText.containsAny(document.rawText(), marker.getKey())) {
                            return List.of(new FieldChange(FieldPath.of("currency"),
                                    fields.currency(), marker.getValue()));
                        }
                    }
                    return List.of();
                })
                .build();
    }

    public static CorrectionRule skontoRule() {
        return CorrectionRule.builder()
                .name("freight-skonto-terms")
                .vendor(FREIGHT_AND_CO)
                .pattern(SKONTO_PATTERN)
                .targetField("paymentTerms")
                .matcher(document -> {
                    InvoiceFields fields = document.fields();
                    if (!DocumentText.isBlank(fields.paymentTerms())
                            || !DocumentText.containsAny(document.rawText(), "skonto")) {
                        return List.of();
                    }
                    return List.of(new FieldChange(FieldPath.of("paymentTerms"),
                            fields.paymentTerms(), SKONTO_DETECTED));
                })
                .build();
    }

    /**
     * Freight &amp; Co bills shipping without a SKU; classify those lines as FREIGHT.
     */
    public static CorrectionRule freightSkuRule() {
        return CorrectionRule.builder()
                .name("freight-sku-mapping")
                .vendor(FREIGHT_AND_CO)
                .pattern(FREIGHT_SKU_PATTERN)
                .targetField("lineItems[].sku")
                .matcher(document -> {
                    List<LineItem> items = document.fields().lineItems();
                    List<FieldChange> changes = new ArrayList<>();
                    for (int i = 0; i < items.size(); i++) {
                        LineItem item = items.get(i);
                        if (DocumentText.isBlank(item.sku())
                                && DocumentText.containsAny(item.description(), "seefracht", "shipping", "freight")) {
                            changes.add(new FieldChange(FieldPath.element("lineItems", i, "sku"),
                                    item.sku(), FREIGHT_SKU));
                        }
                    }
                    return changes;
                })
                .build();
    }
}
