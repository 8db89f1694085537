package com.invoice.memory.decision;

import com.invoice.memory.core.model.Memory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceDecayEngineTest {

    private static final Instant LAST_UPDATED = Instant.parse("2024-01-01T12:00:00Z");

    private ConfidenceDecayEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ConfidenceDecayEngine();
    }

    @Nested
    @DisplayName("Decay Math")
    class DecayMath {

        @Test
        @DisplayName("Less than one whole day leaves the memory unchanged")
        void partialDayUnchanged() {
            Memory memory = memory(0.9, LAST_UPDATED);
            ConfidenceDecayEngine.DecayResult result =
                    engine.decay(memory, LAST_UPDATED.plus(Duration.ofHours(23)));

            assertFalse(result.changed());
            assertSame(memory, result.memory());
        }

        @Test
        @DisplayName("Each whole day costs 0.01")
        void linearDecay() {
            Instant now = LAST_UPDATED.plus(Duration.ofDays(10)).plus(Duration.ofHours(5));
            assertEquals(0.8, engine.decayedConfidence(memory(0.9, LAST_UPDATED), now), 1e-9);
        }

        @Test
        @DisplayName("Decay never drops below the 0.2 floor")
        void floor() {
            Instant now = LAST_UPDATED.plus(Duration.ofDays(10_000));
            assertEquals(0.2, engine.decayedConfidence(memory(0.9, LAST_UPDATED), now), 1e-9);
        }

        @Test
        @DisplayName("A memory already below the floor is not raised")
        void belowFloorNotRaised() {
            Instant now = LAST_UPDATED.plus(Duration.ofDays(30));
            assertEquals(0.1, engine.decayedConfidence(memory(0.1, LAST_UPDATED), now), 1e-9);
        }

        @Test
        @DisplayName("Counters are never touched")
        void countersUntouched() {
            Memory memory = Memory.builder().vendor("v").pattern("p").confidence(0.9)
                    .approvals(4).rejections(2).lastUpdated(LAST_UPDATED).build();
            Memory decayed = engine.decay(memory, LAST_UPDATED.plus(Duration.ofDays(5))).memory();

            assertEquals(4, decayed.approvals());
            assertEquals(2, decayed.rejections());
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class Idempotence {

        @Test
        @DisplayName("Decaying twice on the same day equals decaying once")
        void sameDayIdempotent() {
            Instant morning = LAST_UPDATED.plus(Duration.ofDays(3));
            Instant evening = morning.plus(Duration.ofHours(8));

            ConfidenceDecayEngine.DecayResult once = engine.decay(memory(0.9, LAST_UPDATED), morning);
            ConfidenceDecayEngine.DecayResult twice = engine.decay(once.memory(), evening);

            assertTrue(once.changed());
            assertFalse(twice.changed());
            assertEquals(once.memory().confidence(), twice.memory().confidence());
        }

        @Test
        @DisplayName("A decayed memory carries the evaluation time as lastUpdated")
        void refreshedTimestamp() {
            Instant now = LAST_UPDATED.plus(Duration.ofDays(2));
            assertEquals(now, engine.decay(memory(0.9, LAST_UPDATED), now).memory().lastUpdated());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Missing timestamp is reported as malformed")
        void missingTimestamp() {
            Memory memory = memory(0.9, null);
            assertThrows(MalformedTimestampException.class,
                    () -> engine.decay(memory, LAST_UPDATED));
        }

        @Test
        @DisplayName("Invalid parameters are rejected")
        void invalidParameters() {
            assertThrows(IllegalArgumentException.class, () -> new ConfidenceDecayEngine(-0.01, 0.2));
            assertThrows(IllegalArgumentException.class, () -> new ConfidenceDecayEngine(0.01, 1.5));
        }
    }

    private static Memory memory(double confidence, Instant lastUpdated) {
        return Memory.builder()
                .vendor("Supplier GmbH")
                .pattern("Leistungsdatum -> serviceDate")
                .confidence(confidence)
                .lastUpdated(lastUpdated)
                .build();
    }
}
