package org.sandcastle.migrations.graph.snapshot;

import java.io.IOException;
import java.util.List;

import org.sandcastle.migrations.graph.ir.Snapshot;

/**
 * Append/read/clear log of Phase 1 outcomes, keyed by entity type.
 * Snapshots of a type are read only after Phase 1 has finished writing them.
 */
public interface SnapshotStore extends AutoCloseable {

    void appendSnapshot(Snapshot snapshot) throws IOException;

    /** Every snapshot of the type, in the order they were appended. */
    List<Snapshot> readSnapshots(String entityType) throws IOException;

    void clearSnapshots() throws IOException;

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
