package com.invoice.memory.rules;

import com.invoice.memory.core.model.FieldPath;
import com.invoice.memory.core.model.InvoiceDocument;
import com.invoice.memory.core.model.Memory;
import com.invoice.memory.core.model.MemoryKey;
import com.invoice.memory.core.model.ProposedCorrection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of correction rules keyed by (vendor, pattern).
 *
 * <p>Registration also populates a field-to-pattern index per vendor, so any
 * correction a rule can emit is traceable back to the pattern whose memory
 * should receive feedback. A vendor field maps to exactly one pattern.</p>
 *
 * <p>New behaviour is added by registering new rules; existing rules are never
 * replaced.</p>
 */
public class CorrectionRuleRegistry {
    private static final Logger log = LoggerFactory.getLogger(CorrectionRuleRegistry.class);

    private final Map<MemoryKey, CorrectionRule> rules = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> patternsByField = new ConcurrentHashMap<>();

    public CorrectionRuleRegistry() {
    }

    public CorrectionRuleRegistry(List<CorrectionRule> initialRules) {
        initialRules.forEach(this::register);
    }

    /**
     * Registers a rule.
     *
     * @throws IllegalArgumentException if a rule for the same (vendor, pattern) exists,
     *                                  or the vendor's target field is already owned by another pattern
     */
    public synchronized CorrectionRuleRegistry register(CorrectionRule rule) {
        MemoryKey key = new MemoryKey(rule.getVendor(), rule.getPattern());
        if (rules.containsKey(key)) {
            throw new IllegalArgumentException("Rule already registered for " + key.lockKey());
        }
        Map<String, String> fields = patternsByField.computeIfAbsent(rule.getVendor(), v -> new ConcurrentHashMap<>());
        String template = rule.getTargetField().template();
        String owner = fields.get(template);
        if (owner != null) {
            throw new IllegalArgumentException("Field '" + template + "' of vendor '" + rule.getVendor()
                    + "' is already mapped to pattern '" + owner + "'");
        }
        rules.put(key, rule);
        fields.put(template, rule.getPattern());
        log.debug("Registered correction rule {}", rule);
        return this;
    }

    public Optional<CorrectionRule> ruleFor(String vendor, String pattern) {
        return Optional.ofNullable(rules.get(new MemoryKey(vendor, pattern)));
    }

    /**
     * Resolves the pattern that owns a (possibly indexed) field for a vendor.
     *
     * @throws UnknownPatternException if no registered rule writes that field
     */
    public String patternFor(String vendor, FieldPath field) {
        Map<String, String> fields = patternsByField.getOrDefault(vendor, Map.of());
        String pattern = fields.get(field.template());
        if (pattern == null) {
            throw new UnknownPatternException("No pattern registered for field '" + field
                    + "' of vendor '" + vendor + "'");
        }
        return pattern;
    }

    /**
     * Field template written by the rule registered for a vendor and pattern.
     */
    public Optional<FieldPath> fieldFor(String vendor, String pattern) {
        return ruleFor(vendor, pattern).map(CorrectionRule::getTargetField);
    }

    /**
     * Runs the matching rule of every memory against the document.
     * Memories without a registered rule contribute nothing.
     */
    public List<ProposedCorrection> propose(InvoiceDocument document, List<Memory> memories) {
        List<ProposedCorrection> candidates = new ArrayList<>();
        for (Memory memory : memories) {
            ruleFor(document.vendor(), memory.pattern())
                    .ifPresent(rule -> candidates.addAll(rule.apply(document, memory)));
        }
        return candidates;
    }

    public int size() {
        return rules.size();
    }
}
