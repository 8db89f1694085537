package com.invoice.memory.decision;

import com.invoice.memory.core.model.Memory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes time-based confidence decay for memories.
 *
 * <p>Formula:</p>
 * <pre>
 * daysPassed = floor((now - lastUpdated) / 1 day)
 * decayed    = max(minConfidence, confidence - daysPassed * decayRatePerDay)
 * </pre>
 *
 * <p>Decay is evaluated lazily at read time. A memory whose whole-day age is zero
 * (or negative) is returned unchanged, so evaluating twice on the same day has
 * the same effect as evaluating once. Counters are never touched.</p>
 */
public class ConfidenceDecayEngine {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceDecayEngine.class);

    public static final double DEFAULT_DECAY_RATE_PER_DAY = 0.01;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.2;

    private final double decayRatePerDay;
    private final double minConfidence;

    /**
     * Creates a ConfidenceDecayEngine with default parameters (1% per day, floor 0.2).
     */
    public ConfidenceDecayEngine() {
        this(DEFAULT_DECAY_RATE_PER_DAY, DEFAULT_MIN_CONFIDENCE);
    }

    /**
     * Creates a ConfidenceDecayEngine with configurable parameters.
     *
     * @param decayRatePerDay confidence lost per whole day without reinforcement
     * @param minConfidence   floor below which decay never pushes a memory
     */
    public ConfidenceDecayEngine(double decayRatePerDay, double minConfidence) {
        if (decayRatePerDay < 0.0) {
            throw new IllegalArgumentException("decayRatePerDay must be non-negative");
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be between 0.0 and 1.0");
        }
        this.decayRatePerDay = decayRatePerDay;
        this.minConfidence = minConfidence;
    }

    /**
     * Whole days elapsed between the memory's last update and {@code now}.
     *
     * @throws MalformedTimestampException if the memory has no timestamp
     */
    public long daysPassed(Memory memory, Instant now) {
        Instant last = memory.lastUpdated();
        if (last == null) {
            throw new MalformedTimestampException("Memory " + memory.id() + " has no lastUpdated timestamp");
        }
        return Math.floorDiv(Duration.between(last, now).toMillis(), Duration.ofDays(1).toMillis());
    }

    /**
     * Computes the decayed confidence of a memory at {@code now}.
     * Returns the stored confidence when less than one full day has passed.
     */
    public double decayedConfidence(Memory memory, Instant now) {
        long days = daysPassed(memory, now);
        if (days <= 0) {
            return memory.confidence();
        }
        double decayed = Math.max(minConfidence, memory.confidence() - days * decayRatePerDay);
        // a memory already below the floor (e.g. after a rejection) is not raised by decay
        return Math.min(memory.confidence(), decayed);
    }

    /**
     * Applies decay to a memory.
     *
     * @return a {@link DecayResult} holding the memory to surface and whether
     *         the store must persist it
     */
    public DecayResult decay(Memory memory, Instant now) {
        double current = memory.confidence();
        double decayed = decayedConfidence(memory, now);
        if (decayed == current) {
            return new DecayResult(memory, false);
        }
        log.trace("Confidence decay: memory={} pattern='{}' {} -> {}",
                memory.id(), memory.pattern(), current, decayed);
        return new DecayResult(memory.withConfidence(decayed, now), true);
    }

    public double getDecayRatePerDay() {
        return decayRatePerDay;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    /**
     * Outcome of a decay evaluation.
     *
     * @param memory  the memory to hand to the caller (decayed if {@code changed})
     * @param changed whether confidence dropped and must be written back
     */
    public record DecayResult(Memory memory, boolean changed) {
    }
}
