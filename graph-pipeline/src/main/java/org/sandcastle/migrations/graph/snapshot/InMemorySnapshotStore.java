package org.sandcastle.migrations.graph.snapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.sandcastle.migrations.graph.ir.Snapshot;

/**
 * Keeps snapshots for the lifetime of the process only.
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, List<Snapshot>> byType = new LinkedHashMap<>();

    @Override
    public synchronized void appendSnapshot(Snapshot snapshot) {
        byType.computeIfAbsent(snapshot.entityType(), t -> new ArrayList<>()).add(snapshot);
    }

    @Override
    public synchronized List<Snapshot> readSnapshots(String entityType) {
        return List.copyOf(byType.getOrDefault(entityType, List.of()));
    }

    @Override
    public synchronized void clearSnapshots() {
        byType.clear();
    }

    public synchronized int size() {
        return byType.values().stream().mapToInt(List::size).sum();
    }
}
