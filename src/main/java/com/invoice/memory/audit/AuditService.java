package com.invoice.memory.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Process-wide log of memory updates, decisions and reviews.
 * Unlike the per-document audit trail in the output contract, entries here
 * accumulate across calls, up to {@code maxEntries}; the oldest entry is
 * dropped once the log is full.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String PIPELINE_ACTOR = "pipeline";
    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final Deque<AuditEntry> entries = new ArrayDeque<>();
    private final Clock clock;
    private final int maxEntries;

    public AuditService() {
        this(Clock.systemUTC());
    }

    public AuditService(Clock clock) {
        this(clock, DEFAULT_MAX_ENTRIES);
    }

    public AuditService(Clock clock, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    public synchronized AuditEntry record(AuditEntry entry) {
        if (entries.size() == maxEntries) {
            AuditEntry evicted = entries.removeFirst();
            log.trace("audit.evicted action={} subject={}", evicted.action(), evicted.subjectId());
        }
        entries.addLast(entry);
        log.debug("audit.recorded action={} subject={} actor={}",
                entry.action(), entry.subjectId(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .subjectId(subjectId)
                .actorId(actorId)
                .details(details)
                .timestamp(clock.instant())
                .build());
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId) {
        return record(action, subjectId, actorId, null);
    }

    public synchronized List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized List<AuditEntry> getEntriesForSubject(String subjectId) {
        return entries.stream()
                .filter(e -> subjectId.equals(e.subjectId()))
                .toList();
    }

    public synchronized List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    /**
     * Gets the most recent entries, oldest first.
     */
    public synchronized List<AuditEntry> getRecentEntries(int limit) {
        List<AuditEntry> all = new ArrayList<>(entries);
        int size = all.size();
        if (size <= limit) {
            return Collections.unmodifiableList(all);
        }
        return Collections.unmodifiableList(all.subList(size - limit, size));
    }
}
