package org.sandcastle.migrations.graph.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.sandcastle.migrations.graph.ir.UpdatePayload;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Port for writing records to the store that receives the copy and assigns its own ids.
 */
public interface RecordTarget extends AutoCloseable {

    /**
     * Create one record. Fails with {@link DuplicateRecordException} on a unique-constraint
     * conflict and with {@link RecordStoreException} otherwise.
     */
    Mono<String> createRecord(String entityType, Map<String, Object> payload);

    /**
     * Create many records in one request. The emitted list has one id per payload,
     * in the order the payloads were given. Fails with {@link BulkOperationException}.
     */
    Mono<List<String>> bulkCreate(String entityType, List<Map<String, Object>> payloads);

    Mono<Void> updateRecord(String entityType, String id, Map<String, Object> fields);

    Mono<Void> bulkUpdate(String entityType, List<UpdatePayload> updates);

    Mono<Void> deleteRecord(String entityType, String id);

    /** Ids of the target records matching the query. */
    Flux<String> queryIds(RecordQuery query);

    default Mono<Boolean> exists(String entityType, String id) {
        return queryIds(RecordQuery.byIds(entityType, List.of(id)).withLimit(1)).hasElements();
    }

    default Optional<String> endpoint() {
        return Optional.empty();
    }

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
