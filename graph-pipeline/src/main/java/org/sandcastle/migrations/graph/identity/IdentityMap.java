package org.sandcastle.migrations.graph.identity;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.sandcastle.migrations.graph.ir.Snapshot;

import lombok.extern.slf4j.Slf4j;

/**
 * Per entity type, source id to target id. The single source of truth for "already migrated".
 *
 * Entries are written once and never overwritten; a second write for the same source id
 * keeps the first target id. One writer, many readers.
 */
@Slf4j
public class IdentityMap {

    private final Map<String, Map<String, String>> byType = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Optional<String> lookup(String entityType, String sourceId) {
        if (sourceId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byType.getOrDefault(entityType, Map.of()).get(sourceId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String entityType, String sourceId) {
        return lookup(entityType, sourceId).isPresent();
    }

    /**
     * Record a mapping unless one exists.
     *
     * @return the target id now mapped for the source id, which is the existing one on re-entry
     */
    public String putIfAbsent(String entityType, String sourceId, String targetId) {
        lock.writeLock().lock();
        try {
            var mapping = byType.computeIfAbsent(entityType, t -> new LinkedHashMap<>());
            String existing = mapping.putIfAbsent(sourceId, targetId);
            if (existing != null && !existing.equals(targetId)) {
                log.atWarn().setMessage("{} {} is already mapped to {}, ignoring {}")
                    .addArgument(entityType).addArgument(sourceId).addArgument(existing).addArgument(targetId).log();
            }
            return existing != null ? existing : targetId;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Seed from snapshots of a previous run so materialization can resume. */
    public int seed(Collection<Snapshot> snapshots) {
        int added = 0;
        for (Snapshot snapshot : snapshots) {
            if (!contains(snapshot.entityType(), snapshot.sourceId())) {
                putIfAbsent(snapshot.entityType(), snapshot.sourceId(), snapshot.targetId());
                added++;
            }
        }
        return added;
    }

    public int size(String entityType) {
        lock.readLock().lock();
        try {
            return byType.getOrDefault(entityType, Map.of()).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> sourceIds(String entityType) {
        return mappingsOf(entityType).keySet();
    }

    /** Copy of the current mappings of one type, in insertion order. */
    public Map<String, String> mappingsOf(String entityType) {
        lock.readLock().lock();
        try {
            return new LinkedHashMap<>(byType.getOrDefault(entityType, Map.of()));
        } finally {
            lock.readLock().unlock();
        }
    }
}
