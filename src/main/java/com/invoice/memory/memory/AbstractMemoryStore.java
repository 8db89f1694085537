package com.invoice.memory.memory;

import com.invoice.memory.core.model.Memory;
import com.invoice.memory.decision.ConfidenceDecayEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class wiring lazy confidence decay into the decayed read paths.
 * Subclasses provide raw lookups and the decay write-back.
 */
public abstract class AbstractMemoryStore implements MemoryStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractMemoryStore.class);

    protected final ConfidenceDecayEngine decayEngine;
    protected final Clock clock;

    protected AbstractMemoryStore(ConfidenceDecayEngine decayEngine, Clock clock) {
        this.decayEngine = Objects.requireNonNull(decayEngine, "decayEngine is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public List<Memory> memoriesForVendor(String vendor) {
        return findByVendor(vendor).stream()
                .map(this::decayed)
                .toList();
    }

    @Override
    public Optional<Memory> memoryByPattern(String vendor, String pattern) {
        return memoryByVendorAndPattern(vendor, pattern).map(this::decayed);
    }

    /**
     * Applies decay to a raw memory and persists the result when confidence dropped.
     */
    protected Memory decayed(Memory memory) {
        ConfidenceDecayEngine.DecayResult result = decayEngine.decay(memory, clock.instant());
        if (result.changed()) {
            writeDecayed(result.memory());
            log.debug("memory.decayed id={} pattern='{}' confidence={} -> {}",
                    memory.id(), memory.pattern(), memory.confidence(), result.memory().confidence());
        }
        return result.memory();
    }

    /**
     * Raw memories for a vendor, without decay.
     */
    protected abstract List<Memory> findByVendor(String vendor);

    /**
     * Persists a decayed confidence and its refreshed lastUpdated timestamp.
     */
    protected abstract void writeDecayed(Memory memory);
}
