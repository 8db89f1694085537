package com.invoice.memory.core.model;

/**
 * Feedback supplied with a document. {@link #NONE} disables the learn stage.
 */
public enum Verdict {
    APPROVED,
    REJECTED,
    NONE;

    /**
     * Maps a nullable approval flag: {@code true} approves, {@code false} rejects,
     * {@code null} means no feedback.
     */
    public static Verdict of(Boolean humanApproved) {
        if (humanApproved == null) {
            return NONE;
        }
        return humanApproved ? APPROVED : REJECTED;
    }

    public boolean present() {
        return this != NONE;
    }
}
