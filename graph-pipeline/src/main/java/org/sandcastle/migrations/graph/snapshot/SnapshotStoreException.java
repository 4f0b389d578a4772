package org.sandcastle.migrations.graph.snapshot;

import org.sandcastle.migrations.graph.MigrationException;

/**
 * The snapshot log could not be written or read. Without it Phase 2 has nothing to work from,
 * so this ends the run.
 */
public class SnapshotStoreException extends MigrationException {
    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
