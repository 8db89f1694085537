package com.invoice.memory.decision;

/**
 * Branch taken by the decide stage for one document.
 */
public enum DecisionOutcome {
    /** Aggregate confidence >= threshold: corrections applied without review. */
    AUTO_APPLIED,

    /** Candidates exist but aggregate confidence is below threshold. */
    ESCALATED,

    /** No memory produced a candidate (including cold start). */
    NO_CORRECTIONS,

    /** Short-circuited by the duplicate guard before recall. */
    DUPLICATE
}
