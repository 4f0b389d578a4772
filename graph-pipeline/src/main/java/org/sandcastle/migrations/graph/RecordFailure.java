package org.sandcastle.migrations.graph;

/**
 * A contained failure on one record, or one field of one record.
 */
public record RecordFailure(
    String entityType,
    String sourceId,
    Phase phase,
    String message
) {
    public enum Phase {
        MATERIALIZE,
        BACKPATCH
    }
}
