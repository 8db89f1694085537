package com.invoice.memory.bulk;

/**
 * Receives progress notifications from a batch run.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed documents processed so far
     * @param total     documents in the batch
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
