package org.sandcastle.migrations.graph.store;

import java.util.Optional;

/**
 * Creation was refused because a unique constraint matched a record already present in the
 * target. When the store names that record, its id is carried here so the caller can adopt it.
 */
public class DuplicateRecordException extends RecordStoreException {
    private final String existingId;

    public DuplicateRecordException(String entityType, String existingId, String message) {
        super(entityType, null, message);
        this.existingId = existingId;
    }

    public Optional<String> getExistingId() {
        return Optional.ofNullable(existingId);
    }
}
