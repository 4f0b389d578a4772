package org.sandcastle.migrations.graph.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.sandcastle.migrations.graph.MigrationException;

import lombok.Getter;

/**
 * A flush did not yield one target id per pending entry. The entries are still pending.
 *
 * {@link #getPartialIds()} is either empty or positional over the failed batch,
 * holding {@code null} where an entry was not written.
 */
@Getter
public class BatchFlushException extends MigrationException {
    private final String entityType;
    private final int batchSize;
    private final List<String> partialIds;

    public BatchFlushException(String entityType, int batchSize, List<String> partialIds, String message, Throwable cause) {
        super(message, cause);
        this.entityType = entityType;
        this.batchSize = batchSize;
        this.partialIds = partialIds != null && partialIds.size() == batchSize
            ? Collections.unmodifiableList(new ArrayList<>(partialIds))
            : List.of();
    }

    public boolean hasPartialIds() {
        return partialIds.stream().anyMatch(Objects::nonNull);
    }
}
