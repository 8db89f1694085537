package com.invoice.memory.rules;

import com.invoice.memory.core.model.FieldPath;
import com.invoice.memory.core.model.InvoiceDocument;
import com.invoice.memory.core.model.Memory;
import com.invoice.memory.core.model.ProposedCorrection;

import java.util.List;
import java.util.Objects;

/**
 * A vendor-and-pattern specific correction rule.
 *
 * <p>A rule fires only when all three gates hold: the document's vendor equals
 * {@link #getVendor()}, the memory's pattern equals {@link #getPattern()}, and the
 * matcher finds something to change. Every emitted correction carries the
 * triggering memory's id and confidence unchanged.</p>
 */
public class CorrectionRule {
    private final String name;
    private final String vendor;
    private final String pattern;
    private final FieldPath targetField;
    private final CorrectionMatcher matcher;

    private CorrectionRule(Builder builder) {
        this.name = builder.name;
        this.vendor = builder.vendor;
        this.pattern = builder.pattern;
        this.targetField = FieldPath.parse(builder.targetField);
        this.matcher = builder.matcher;
    }

    public String getName() {
        return name;
    }

    public String getVendor() {
        return vendor;
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * Field template this rule writes, e.g. {@code serviceDate} or {@code lineItems[].sku}.
     */
    public FieldPath getTargetField() {
        return targetField;
    }

    /**
     * Checks the vendor and pattern gates.
     */
    public boolean appliesTo(InvoiceDocument document, Memory memory) {
        return vendor.equals(document.vendor())
                && vendor.equals(memory.vendor())
                && pattern.equals(memory.pattern());
    }

    /**
     * Applies this rule to a document on behalf of a memory.
     *
     * @return proposed corrections, empty if any gate fails
     */
    public List<ProposedCorrection> apply(InvoiceDocument document, Memory memory) {
        if (!appliesTo(document, memory)) {
            return List.of();
        }
        return matcher.match(document).stream()
                .map(change -> {
                    if (!targetField.template().equals(change.field().template())) {
                        throw new IllegalStateException("Rule '" + name + "' declared " + targetField.template()
                                + " but proposed " + change.field());
                    }
                    return new ProposedCorrection(change.field().toString(), change.from(), change.to(),
                            memory.id(), memory.confidence());
                })
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrectionRule that = (CorrectionRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "CorrectionRule{" +
                "name='" + name + '\'' +
                ", vendor='" + vendor + '\'' +
                ", pattern='" + pattern + '\'' +
                ", field=" + targetField.template() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String vendor;
        private String pattern;
        private String targetField;
        private CorrectionMatcher matcher;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder vendor(String vendor) {
            this.vendor = vendor;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder targetField(String targetField) {
            this.targetField = targetField;
            return this;
        }

        public Builder matcher(CorrectionMatcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public CorrectionRule build() {
            Objects.requireNonNull(vendor, "vendor is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(targetField, "targetField is required");
            Objects.requireNonNull(matcher, "matcher is required");
            if (name == null) {
                name = vendor + ":" + pattern;
            }
            return new CorrectionRule(this);
        }
    }
}
