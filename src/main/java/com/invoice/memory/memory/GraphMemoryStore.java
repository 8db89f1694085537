package com.invoice.memory.memory;

import com.invoice.memory.core.model.Memory;
import com.invoice.memory.core.model.MemoryType;
import com.invoice.memory.decision.ConfidenceDecayEngine;
import com.invoice.memory.decision.MalformedTimestampException;
import com.invoice.memory.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * FalkorDB-backed implementation of {@link MemoryStore}.
 * Persists each memory as a {@code :Memory} node; (vendor, pattern) is unique
 * because every write goes through a lookup on that pair first.
 *
 * <p>Connection failures are wrapped in {@link MemoryStoreException}.</p>
 */
public class GraphMemoryStore extends AbstractMemoryStore {
    private static final Logger log = LoggerFactory.getLogger(GraphMemoryStore.class);

    private static final String RETURN_MEMORY = """
            RETURN m.id as id, m.type as type, m.vendor as vendor, m.pattern as pattern,
                   m.confidence as confidence, m.approvals as approvals,
                   m.rejections as rejections, m.lastUpdated as lastUpdated
            """;

    private final GraphConnection connection;

    public GraphMemoryStore(GraphConnection connection) {
        this(connection, new ConfidenceDecayEngine(), Clock.systemUTC());
    }

    public GraphMemoryStore(GraphConnection connection, ConfidenceDecayEngine decayEngine, Clock clock) {
        super(decayEngine, clock);
        this.connection = connection;
        connection.createIndexes();
    }

    @Override
    protected List<Memory> findByVendor(String vendor) {
        String query = "MATCH (m:Memory) WHERE m.vendor = $vendor " + RETURN_MEMORY + " ORDER BY m.pattern";
        List<Map<String, Object>> rows = call("find memories for vendor " + vendor,
                () -> connection.query(query, Map.of("vendor", vendor)));
        return rows.stream().map(this::mapToMemory).toList();
    }

    @Override
    public Optional<Memory> memoryByVendorAndPattern(String vendor, String pattern) {
        String query = "MATCH (m:Memory) WHERE m.vendor = $vendor AND m.pattern = $pattern "
                + RETURN_MEMORY + " LIMIT 1";
        List<Map<String, Object>> rows = call("find memory " + vendor + "/" + pattern,
                () -> connection.query(query, Map.of("vendor", vendor, "pattern", pattern)));
        return rows.stream().findFirst().map(this::mapToMemory);
    }

    @Override
    public Memory save(Memory memory) {
        Optional<Memory> existing = memoryByVendorAndPattern(memory.vendor(), memory.pattern());
        if (existing.isPresent()) {
            Memory current = existing.get();
            Memory merged = current.withStats(
                    Math.max(current.confidence(), memory.confidence()),
                    current.approvals() + memory.approvals(),
                    current.rejections() + memory.rejections(),
                    clock.instant());
            String query = """
                    MATCH (m:Memory {id: $id})
                    SET m.confidence = $confidence,
                        m.approvals = m.approvals + $approvals,
                        m.rejections = m.rejections + $rejections,
                        m.lastUpdated = $lastUpdated
                    """;
            call("merge memory " + current.id(), () -> {
                connection.execute(query, Map.of(
                        "id", current.id(),
                        "confidence", merged.confidence(),
                        "approvals", memory.approvals(),
                        "rejections", memory.rejections(),
                        "lastUpdated", merged.lastUpdated().toString()));
                return null;
            });
            log.debug("memory.merged id={} pattern='{}' confidence={}", current.id(), current.pattern(),
                    merged.confidence());
            return merged;
        }

        String query = """
                CREATE (m:Memory {
                    id: $id,
                    type: $type,
                    vendor: $vendor,
                    pattern: $pattern,
                    confidence: $confidence,
                    approvals: $approvals,
                    rejections: $rejections,
                    lastUpdated: $lastUpdated
                })
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("id", memory.id());
        params.put("type", memory.type().name());
        params.put("vendor", memory.vendor());
        params.put("pattern", memory.pattern());
        params.put("confidence", memory.confidence());
        params.put("approvals", memory.approvals());
        params.put("rejections", memory.rejections());
        params.put("lastUpdated", memory.lastUpdated() != null ? memory.lastUpdated().toString() : null);
        call("create memory " + memory.id(), () -> {
            connection.execute(query, params);
            return null;
        });
        log.debug("memory.created id={} vendor='{}' pattern='{}'", memory.id(), memory.vendor(), memory.pattern());
        return memory;
    }

    @Override
    public Memory updateConfidenceAndCounters(String id, double confidence, int approvals, int rejections) {
        String query = """
                MATCH (m:Memory {id: $id})
                SET m.confidence = $confidence,
                    m.approvals = $approvals,
                    m.rejections = $rejections,
                    m.lastUpdated = $lastUpdated
                """ + RETURN_MEMORY;
        List<Map<String, Object>> rows = call("update memory " + id, () -> connection.query(query, Map.of(
                "id", id,
                "confidence", confidence,
                "approvals", approvals,
                "rejections", rejections,
                "lastUpdated", clock.instant().toString())));
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Memory not found: " + id);
        }
        return mapToMemory(rows.get(0));
    }

    @Override
    protected void writeDecayed(Memory memory) {
        String query = """
                MATCH (m:Memory {id: $id})
                SET m.confidence = $confidence, m.lastUpdated = $lastUpdated
                """;
        call("write decay for memory " + memory.id(), () -> {
            connection.execute(query, Map.of(
                    "id", memory.id(),
                    "confidence", memory.confidence(),
                    "lastUpdated", memory.lastUpdated().toString()));
            return null;
        });
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (MemoryStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MemoryStoreException("Graph store failed to " + operation, e);
        }
    }

    private Memory mapToMemory(Map<String, Object> row) {
        return new Memory(
                (String) row.get("id"),
                MemoryType.valueOf((String) row.get("type")),
                (String) row.get("vendor"),
                (String) row.get("pattern"),
                toDouble(row.get("confidence")),
                toInt(row.get("approvals")),
                toInt(row.get("rejections")),
                parseTimestamp((String) row.get("id"), row.get("lastUpdated"))
        );
    }

    private static Instant parseTimestamp(String id, Object value) {
        if (value == null) {
            throw new MalformedTimestampException("Memory " + id + " has no lastUpdated timestamp");
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            throw new MalformedTimestampException("Memory " + id + " has malformed lastUpdated: " + value, e);
        }
    }

    private static double toDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }

    private static int toInt(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }
}
