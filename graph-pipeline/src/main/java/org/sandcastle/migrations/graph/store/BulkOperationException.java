package org.sandcastle.migrations.graph.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A bulk create or update did not fully succeed.
 *
 * When the store reports per-record outcomes, {@link #getPartialResults()} has exactly one
 * slot per submitted record, in submission order, holding the target id of each record that
 * made it and {@code null} for each that did not. Without per-record outcomes the list is empty.
 */
public class BulkOperationException extends RecordStoreException {
    private final List<String> partialResults;

    public BulkOperationException(String entityType, String message, List<String> partialResults) {
        super(entityType, null, message);
        this.partialResults = partialResults == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(partialResults));
    }

    public BulkOperationException(String entityType, String message, Throwable cause) {
        super(entityType, null, message, cause);
        this.partialResults = List.of();
    }

    public List<String> getPartialResults() {
        return partialResults;
    }

    public boolean hasPartialResults() {
        return partialResults.stream().anyMatch(Objects::nonNull);
    }
}
