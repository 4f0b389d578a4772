package org.sandcastle.migrations.graph.store;

import java.util.Optional;

import org.sandcastle.migrations.graph.ir.SourceRecord;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Port for reading records from the store being copied.
 * Implementations return cold publishers; subscription triggers the read.
 */
public interface RecordSource extends AutoCloseable {

    /** Fetch one record; completes empty when the record does not exist. */
    Mono<SourceRecord> fetchRecord(String entityType, String id);

    /** Stream every record matching the query. */
    Flux<SourceRecord> queryRecords(RecordQuery query);

    /** Where this store lives, used to refuse copying a store onto itself. */
    default Optional<String> endpoint() {
        return Optional.empty();
    }

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
