package com.invoice.memory.memory;

import com.invoice.memory.core.model.Memory;
import com.invoice.memory.core.model.MemoryKey;
import com.invoice.memory.decision.ConfidenceDecayEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link MemoryStore}.
 * Suitable for testing and single-JVM deployments. Merges are atomic per
 * (vendor, pattern) key.
 */
public class InMemoryMemoryStore extends AbstractMemoryStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMemoryStore.class);

    private final ConcurrentMap<MemoryKey, Memory> memories = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, MemoryKey> idIndex = new ConcurrentHashMap<>();

    public InMemoryMemoryStore() {
        this(new ConfidenceDecayEngine(), Clock.systemUTC());
    }

    public InMemoryMemoryStore(ConfidenceDecayEngine decayEngine, Clock clock) {
        super(decayEngine, clock);
    }

    @Override
    protected List<Memory> findByVendor(String vendor) {
        return memories.values().stream()
                .filter(m -> m.vendor().equals(vendor))
                .sorted(Comparator.comparing(Memory::pattern))
                .toList();
    }

    @Override
    public Optional<Memory> memoryByVendorAndPattern(String vendor, String pattern) {
        return Optional.ofNullable(memories.get(new MemoryKey(vendor, pattern)));
    }

    @Override
    public Memory save(Memory memory) {
        Instant now = clock.instant();
        Memory stored = memories.compute(memory.key(), (key, existing) -> {
            if (existing == null) {
                return memory;
            }
            return existing.withStats(
                    Math.max(existing.confidence(), memory.confidence()),
                    existing.approvals() + memory.approvals(),
                    existing.rejections() + memory.rejections(),
                    now);
        });
        idIndex.put(stored.id(), stored.key());
        log.debug("memory.saved id={} vendor='{}' pattern='{}' confidence={} approvals={} rejections={}",
                stored.id(), stored.vendor(), stored.pattern(), stored.confidence(),
                stored.approvals(), stored.rejections());
        return stored;
    }

    @Override
    public Memory updateConfidenceAndCounters(String id, double confidence, int approvals, int rejections) {
        MemoryKey key = idIndex.get(id);
        if (key == null) {
            throw new IllegalArgumentException("Memory not found: " + id);
        }
        Instant now = clock.instant();
        return memories.computeIfPresent(key,
                (k, existing) -> existing.withStats(confidence, approvals, rejections, now));
    }

    @Override
    protected void writeDecayed(Memory memory) {
        memories.computeIfPresent(memory.key(),
                (k, existing) -> existing.withConfidence(memory.confidence(), memory.lastUpdated()));
    }

    /**
     * Number of stored memories.
     */
    public int size() {
        return memories.size();
    }
}
