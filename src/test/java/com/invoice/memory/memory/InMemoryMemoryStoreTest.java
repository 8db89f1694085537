package com.invoice.memory.memory;

import com.invoice.memory.core.model.Memory;
import com.invoice.memory.decision.ConfidenceDecayEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import static com.invoice.memory.InvoiceFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryMemoryStoreTest {

    private static final String VENDOR = "Supplier GmbH";
    private static final String PATTERN = "Leistungsdatum -> serviceDate";

    private InMemoryMemoryStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryMemoryStore(new ConfidenceDecayEngine(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Merge on save")
    class MergeOnSave {

        @Test
        @DisplayName("First save inserts verbatim")
        void insert() {
            Memory memory = memory(0.7, 1, 0);
            Memory stored = store.save(memory);

            assertEquals(memory, stored);
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("Saving again keeps the higher confidence and adds counters")
        void merge() {
            store.save(memory(0.7, 2, 1));
            Memory merged = store.save(memory(0.5, 1, 1));

            assertEquals(0.7, merged.confidence());
            assertEquals(3, merged.approvals());
            assertEquals(2, merged.rejections());
            assertEquals(NOW, merged.lastUpdated());
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("A higher incoming confidence replaces the stored one")
        void higherConfidenceWins() {
            store.save(memory(0.5, 0, 0));
            assertEquals(0.9, store.save(memory(0.9, 0, 0)).confidence());
        }

        @Test
        @DisplayName("The first record's id survives merges")
        void idStable() {
            Memory first = store.save(memory(0.5, 0, 0));
            Memory merged = store.save(memory(0.6, 1, 0));
            assertEquals(first.id(), merged.id());
        }
    }

    @Nested
    @DisplayName("Absolute update")
    class AbsoluteUpdate {

        @Test
        @DisplayName("Overwrites confidence and counters")
        void overwrite() {
            Memory saved = store.save(memory(0.5, 5, 5));
            Memory updated = store.updateConfidenceAndCounters(saved.id(), 0.55, 6, 5);

            assertEquals(0.55, updated.confidence());
            assertEquals(6, updated.approvals());
            assertEquals(5, updated.rejections());
            assertEquals(NOW, updated.lastUpdated());
        }

        @Test
        @DisplayName("Unknown id is rejected")
        void unknownId() {
            assertThrows(IllegalArgumentException.class,
                    () -> store.updateConfidenceAndCounters("missing", 0.5, 0, 0));
        }
    }

    @Nested
    @DisplayName("Decay on read")
    class DecayOnRead {

        @Test
        @DisplayName("Vendor reads are decayed and the decay is persisted")
        void decayedAndPersisted() {
            store.save(Memory.builder().vendor(VENDOR).pattern(PATTERN).confidence(0.9)
                    .lastUpdated(NOW.minus(Duration.ofDays(10))).build());

            Memory recalled = store.memoriesForVendor(VENDOR).get(0);
            Memory raw = store.memoryByVendorAndPattern(VENDOR, PATTERN).orElseThrow();

            assertEquals(0.8, recalled.confidence(), 1e-9);
            assertEquals(0.8, raw.confidence(), 1e-9);
            assertEquals(NOW, raw.lastUpdated());
        }

        @Test
        @DisplayName("Raw reads do not decay")
        void rawReadsUndecayed() {
            store.save(Memory.builder().vendor(VENDOR).pattern(PATTERN).confidence(0.9)
                    .lastUpdated(NOW.minus(Duration.ofDays(10))).build());

            assertEquals(0.9, store.memoryByVendorAndPattern(VENDOR, PATTERN).orElseThrow().confidence());
        }

        @Test
        @DisplayName("Reading twice on the same day decays once")
        void idempotentReads() {
            store.save(Memory.builder().vendor(VENDOR).pattern(PATTERN).confidence(0.9)
                    .lastUpdated(NOW.minus(Duration.ofDays(3))).build());

            double first = store.memoryByPattern(VENDOR, PATTERN).orElseThrow().confidence();
            double second = store.memoryByPattern(VENDOR, PATTERN).orElseThrow().confidence();

            assertEquals(0.87, first, 1e-9);
            assertEquals(first, second);
        }

        @Test
        @DisplayName("Reads are scoped to the vendor")
        void vendorScoped() {
            store.save(memory(0.9, 0, 0));
            assertTrue(store.memoriesForVendor("Parts AG").isEmpty());
            assertTrue(store.memoryByPattern("Parts AG", PATTERN).isEmpty());
        }
    }

    private static Memory memory(double confidence, int approvals, int rejections) {
        return Memory.builder()
                .vendor(VENDOR)
                .pattern(PATTERN)
                .confidence(confidence)
                .approvals(approvals)
                .rejections(rejections)
                .lastUpdated(NOW)
                .build();
    }
}
