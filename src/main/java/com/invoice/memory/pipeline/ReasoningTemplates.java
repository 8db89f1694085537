package com.invoice.memory.pipeline;

import java.util.List;
import java.util.Locale;

/**
 * Fixed wording for the {@code reasoning} field of the output contract.
 */
final class ReasoningTemplates {

    private ReasoningTemplates() {
    }

    static String duplicate(String vendor) {
        return String.format(Locale.ROOT,
                "Invoice appears to be a potential duplicate for vendor \"%s\". "
                        + "Human review required to prevent contradictory learning.", vendor);
    }

    static String noCorrections(String vendor) {
        return String.format(Locale.ROOT,
                "No learned memory patterns were applicable for vendor \"%s\". The system processed this "
                        + "invoice without automated corrections, either due to cold-start conditions or "
                        + "insufficient historical confidence.", vendor);
    }

    static String autoApplied(String vendor, List<String> fields, double confidence) {
        return String.format(Locale.ROOT,
                "The system recalled previously human-approved memory patterns for vendor \"%s\" and applied "
                        + "corrections to field(s): %s. The aggregated confidence score (%.2f) met the automation "
                        + "threshold, so the corrections were applied without human intervention.",
                vendor, String.join(", ", fields), confidence);
    }

    static String escalated(String vendor, List<String> fields, double confidence) {
        return String.format(Locale.ROOT,
                "The system identified memory-based suggestions for vendor \"%s\" affecting field(s): %s. "
                        + "However, the confidence score (%.2f) did not meet the automation threshold, so the "
                        + "invoice was escalated for human review.",
                vendor, String.join(", ", fields), confidence);
    }
}
