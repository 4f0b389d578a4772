package org.sandcastle.migrations.graph.store;

import org.sandcastle.migrations.graph.MigrationException;

import lombok.Getter;

/**
 * A record store collaborator rejected or failed an operation.
 */
@Getter
public class RecordStoreException extends MigrationException {
    private final String entityType;
    private final String recordId;

    public RecordStoreException(String entityType, String recordId, String message) {
        super(message);
        this.entityType = entityType;
        this.recordId = recordId;
    }

    public RecordStoreException(String entityType, String recordId, String message, Throwable cause) {
        super(message, cause);
        this.entityType = entityType;
        this.recordId = recordId;
    }
}
