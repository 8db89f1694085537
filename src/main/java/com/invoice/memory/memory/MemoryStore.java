package com.invoice.memory.memory;

import com.invoice.memory.core.model.Memory;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for vendor memories.
 *
 * <p>Read paths that feed the pipeline ({@link #memoriesForVendor} and
 * {@link #memoryByPattern}) apply confidence decay before returning and write
 * the decayed value back. {@link #memoryByVendorAndPattern} returns the raw
 * stored state and is used by the merge path.</p>
 *
 * <p>Two distinct write contracts exist on purpose: {@link #save} merges
 * additively, {@link #updateConfidenceAndCounters} overwrites absolutely.</p>
 */
public interface MemoryStore {

    /**
     * Gets all memories for a vendor, each passed through decay.
     *
     * @param vendor the vendor name
     * @return the decayed memories, empty on cold start
     */
    List<Memory> memoriesForVendor(String vendor);

    /**
     * Gets the memory for a vendor and pattern, passed through decay.
     *
     * @param vendor  the vendor name
     * @param pattern the pattern identifier
     * @return the decayed memory, or empty if none is stored
     */
    Optional<Memory> memoryByPattern(String vendor, String pattern);

    /**
     * Gets the raw stored memory for a vendor and pattern, without decay.
     *
     * @param vendor  the vendor name
     * @param pattern the pattern identifier
     * @return the stored memory, or empty if none is stored
     */
    Optional<Memory> memoryByVendorAndPattern(String vendor, String pattern);

    /**
     * Inserts a memory, or merges it into the existing record with the same
     * (vendor, pattern): confidence becomes the maximum of both, approvals and
     * rejections are added to the stored counters, and lastUpdated is set to now.
     *
     * <p>Saving the same learning event twice double-counts its counters;
     * callers deliver each event at most once.</p>
     *
     * @param memory the memory to insert or merge
     * @return the stored state after the write
     */
    Memory save(Memory memory);

    /**
     * Overwrites confidence and counters of a memory and stamps lastUpdated with now.
     *
     * @param id         the memory id
     * @param confidence the new confidence
     * @param approvals  the new approval count
     * @param rejections the new rejection count
     * @return the stored state after the write
     * @throws IllegalArgumentException if no memory has the given id
     */
    Memory updateConfidenceAndCounters(String id, double confidence, int approvals, int rejections);
}
