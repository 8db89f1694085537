package com.invoice.memory.audit;

/**
 * Auditable events of the invoice memory system.
 */
public enum AuditAction {
    MEMORY_REINFORCED,
    MEMORY_PENALIZED,
    MEMORY_MISSING,
    CORRECTIONS_AUTO_APPLIED,
    DOCUMENT_ESCALATED,
    DUPLICATE_DETECTED,
    REVIEW_SUBMITTED,
    REVIEW_COMPLETED
}
