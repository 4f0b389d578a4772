package org.sandcastle.migrations.graph.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.sandcastle.migrations.graph.ir.SourceRecord;
import org.sandcastle.migrations.graph.ir.UpdatePayload;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A record store held in memory, usable as either side of a migration.
 *
 * Target-side integrity rules (required fields, one unique field per type) and failure
 * injection hooks make it the collaborator for engine tests that need no real store.
 * Every call is recorded so tests can assert on what the engine actually submitted.
 */
@Slf4j
public class InMemoryRecordStore implements RecordSource, RecordTarget, StableNameResolver {

    public enum Operation {
        FETCH,
        QUERY,
        CREATE,
        BULK_CREATE,
        UPDATE,
        BULK_UPDATE,
        DELETE
    }

    public record StoreCall(Operation operation, String entityType, List<Map<String, Object>> payloads) {}

    private final String name;
    private final Map<String, Map<String, Map<String, Object>>> records = new LinkedHashMap<>();
    private final Map<String, Set<String>> requiredFields = new HashMap<>();
    private final Map<String, String> uniqueFields = new HashMap<>();
    private final Map<String, Predicate<Map<String, Object>>> createRejections = new HashMap<>();
    private final Map<String, Set<String>> rejectedUpdateFields = new HashMap<>();
    private final Map<String, Integer> pendingBulkCreateFailures = new HashMap<>();
    private final Map<String, Integer> pendingBulkUpdateFailures = new HashMap<>();
    private final Map<String, String> stableNames = new HashMap<>();
    private final List<StoreCall> calls = new CopyOnWriteArrayList<>();
    private final AtomicLong idSequence = new AtomicLong();
    private boolean reportPartialBulkResults;

    public InMemoryRecordStore(String name) {
        this.name = name;
    }

    // ---- setup ----

    public InMemoryRecordStore put(String entityType, String id, Map<String, Object> fields) {
        synchronized (records) {
            records.computeIfAbsent(entityType, t -> new LinkedHashMap<>()).put(id, new LinkedHashMap<>(fields));
        }
        return this;
    }

    public InMemoryRecordStore put(SourceRecord record) {
        return put(record.entityType(), record.id(), record.fields());
    }

    public InMemoryRecordStore requireFields(String entityType, String... fieldNames) {
        requiredFields.computeIfAbsent(entityType, t -> new HashSet<>()).addAll(List.of(fieldNames));
        return this;
    }

    public InMemoryRecordStore uniqueField(String entityType, String fieldName) {
        uniqueFields.put(entityType, fieldName);
        return this;
    }

    public InMemoryRecordStore rejectCreateWhen(String entityType, Predicate<Map<String, Object>> rejection) {
        createRejections.put(entityType, rejection);
        return this;
    }

    public InMemoryRecordStore rejectUpdatesOf(String entityType, String fieldName) {
        rejectedUpdateFields.computeIfAbsent(entityType, t -> new HashSet<>()).add(fieldName);
        return this;
    }

    public InMemoryRecordStore failNextBulkCreates(String entityType, int times) {
        pendingBulkCreateFailures.put(entityType, times);
        return this;
    }

    public InMemoryRecordStore failNextBulkUpdates(String entityType, int times) {
        pendingBulkUpdateFailures.put(entityType, times);
        return this;
    }

    /** When set, a bulk create with some rejected records keeps the good ones and reports them positionally. */
    public InMemoryRecordStore reportPartialBulkResults(boolean enabled) {
        this.reportPartialBulkResults = enabled;
        return this;
    }

    public InMemoryRecordStore registerStableName(String ownerEntityType, String sourceRef, String targetRef) {
        stableNames.put(ownerEntityType + "|" + sourceRef, targetRef);
        return this;
    }

    // ---- inspection ----

    public Optional<Map<String, Object>> get(String entityType, String id) {
        synchronized (records) {
            var byId = records.getOrDefault(entityType, Map.of());
            return Optional.ofNullable(byId.get(id)).map(Collections::unmodifiableMap);
        }
    }

    public List<String> ids(String entityType) {
        synchronized (records) {
            return new ArrayList<>(records.getOrDefault(entityType, Map.of()).keySet());
        }
    }

    public int count(String entityType) {
        return ids(entityType).size();
    }

    public List<StoreCall> getCalls() {
        return Collections.unmodifiableList(calls);
    }

    public List<StoreCall> callsOf(Operation operation, String entityType) {
        return calls.stream()
            .filter(c -> c.operation() == operation && c.entityType().equals(entityType))
            .collect(Collectors.toList());
    }

    // ---- RecordSource ----

    @Override
    public Mono<SourceRecord> fetchRecord(String entityType, String id) {
        return Mono.defer(() -> {
            calls.add(new StoreCall(Operation.FETCH, entityType, List.of()));
            return Mono.justOrEmpty(get(entityType, id).map(fields -> new SourceRecord(entityType, id, fields)));
        });
    }

    @Override
    public Flux<SourceRecord> queryRecords(RecordQuery query) {
        return Flux.defer(() -> {
            calls.add(new StoreCall(Operation.QUERY, query.entityType(), List.of()));
            return Flux.fromIterable(matching(query))
                .map(e -> new SourceRecord(query.entityType(), e.getKey(), e.getValue()));
        });
    }

    @Override
    public Optional<String> endpoint() {
        return Optional.of("memory://" + name);
    }

    @Override
    public void close() {
        // nothing held open
    }

    // ---- RecordTarget ----

    @Override
    public Mono<String> createRecord(String entityType, Map<String, Object> payload) {
        return Mono.fromCallable(() -> {
            calls.add(new StoreCall(Operation.CREATE, entityType, List.of(Map.copyOf(nonNull(payload)))));
            synchronized (records) {
                validateCreate(entityType, payload);
                return insert(entityType, payload);
            }
        });
    }

    @Override
    public Mono<List<String>> bulkCreate(String entityType, List<Map<String, Object>> payloads) {
        return Mono.fromCallable(() -> {
            calls.add(new StoreCall(Operation.BULK_CREATE, entityType,
                payloads.stream().map(p -> Map.copyOf(nonNull(p))).collect(Collectors.toList())));
            synchronized (records) {
                if (consumeFailure(pendingBulkCreateFailures, entityType)) {
                    throw new BulkOperationException(entityType, "Bulk job for " + entityType + " failed", List.of());
                }
                var rejected = new ArrayList<Integer>();
                for (int i = 0; i < payloads.size(); i++) {
                    try {
                        validateCreate(entityType, payloads.get(i));
                    } catch (RecordStoreException e) {
                        rejected.add(i);
                    }
                }
                if (rejected.isEmpty()) {
                    var ids = new ArrayList<String>(payloads.size());
                    for (var payload : payloads) {
                        ids.add(insert(entityType, payload));
                    }
                    return ids;
                }
                if (!reportPartialBulkResults) {
                    throw new BulkOperationException(entityType,
                        rejected.size() + " of " + payloads.size() + " " + entityType + " records rejected", List.of());
                }
                var positional = new ArrayList<String>(payloads.size());
                for (int i = 0; i < payloads.size(); i++) {
                    positional.add(rejected.contains(i) ? null : insert(entityType, payloads.get(i)));
                }
                throw new BulkOperationException(entityType,
                    rejected.size() + " of " + payloads.size() + " " + entityType + " records rejected", positional);
            }
        });
    }

    @Override
    public Mono<Void> updateRecord(String entityType, String id, Map<String, Object> fields) {
        return Mono.<Void>fromRunnable(() -> {
            calls.add(new StoreCall(Operation.UPDATE, entityType, List.of(Map.copyOf(nonNull(fields)))));
            synchronized (records) {
                validateUpdate(entityType, id, fields);
                records.get(entityType).get(id).putAll(fields);
            }
        });
    }

    @Override
    public Mono<Void> bulkUpdate(String entityType, List<UpdatePayload> updates) {
        return Mono.<Void>fromRunnable(() -> {
            calls.add(new StoreCall(Operation.BULK_UPDATE, entityType,
                updates.stream().map(u -> Map.copyOf(nonNull(u.fields()))).collect(Collectors.toList())));
            synchronized (records) {
                if (consumeFailure(pendingBulkUpdateFailures, entityType)) {
                    throw new BulkOperationException(entityType, "Bulk update job for " + entityType + " failed", List.of());
                }
                if (!reportPartialBulkResults) {
                    for (var update : updates) {
                        try {
                            validateUpdate(entityType, update.targetId(), update.fields());
                        } catch (RecordStoreException e) {
                            throw new BulkOperationException(entityType, "Bulk update rejected: " + e.getMessage(), e);
                        }
                    }
                    for (var update : updates) {
                        records.get(entityType).get(update.targetId()).putAll(update.fields());
                    }
                    return;
                }
                var positional = new ArrayList<String>(updates.size());
                int rejected = 0;
                for (var update : updates) {
                    try {
                        validateUpdate(entityType, update.targetId(), update.fields());
                        records.get(entityType).get(update.targetId()).putAll(update.fields());
                        positional.add(update.targetId());
                    } catch (RecordStoreException e) {
                        positional.add(null);
                        rejected++;
                    }
                }
                if (rejected > 0) {
                    throw new BulkOperationException(entityType,
                        rejected + " of " + updates.size() + " " + entityType + " updates rejected", positional);
                }
            }
        });
    }

    @Override
    public Mono<Void> deleteRecord(String entityType, String id) {
        return Mono.<Void>fromRunnable(() -> {
            calls.add(new StoreCall(Operation.DELETE, entityType, List.of()));
            synchronized (records) {
                var byId = records.get(entityType);
                if (byId == null || byId.remove(id) == null) {
                    throw new RecordStoreException(entityType, id, "ENTITY_IS_DELETED: no " + entityType + " " + id);
                }
            }
        });
    }

    @Override
    public Flux<String> queryIds(RecordQuery query) {
        return Flux.defer(() -> Flux.fromIterable(matching(query)).map(Map.Entry::getKey));
    }

    // ---- StableNameResolver ----

    @Override
    public Mono<String> resolveStableName(String ownerEntityType, String sourceRef) {
        return Mono.justOrEmpty(stableNames.get(ownerEntityType + "|" + sourceRef));
    }

    // ---- internals ----

    private List<Map.Entry<String, Map<String, Object>>> matching(RecordQuery query) {
        synchronized (records) {
            var stream = records.getOrDefault(query.entityType(), Map.of()).entrySet().stream()
                .filter(e -> matches(query, e.getKey(), e.getValue()))
                .map(e -> Map.entry(e.getKey(), Map.copyOf(nonNull(e.getValue()))));
            if (query.isLimited()) {
                stream = stream.limit(query.limit());
            }
            return stream.collect(Collectors.toList());
        }
    }

    private static boolean matches(RecordQuery query, String id, Map<String, Object> fields) {
        if (query.anyOf().isEmpty()) {
            return true;
        }
        return query.anyOf().stream().anyMatch(condition -> {
            Object value = RecordQuery.ID_FIELD.equals(condition.field()) ? id : fields.get(condition.field());
            return value != null && condition.values().contains(String.valueOf(value));
        });
    }

    private void validateCreate(String entityType, Map<String, Object> payload) {
        for (String required : requiredFields.getOrDefault(entityType, Set.of())) {
            if (payload.get(required) == null) {
                throw new RecordStoreException(entityType, null,
                    "REQUIRED_FIELD_MISSING: Required fields are missing: [" + required + "]");
            }
        }
        var rejection = createRejections.get(entityType);
        if (rejection != null && rejection.test(payload)) {
            throw new RecordStoreException(entityType, null, "FIELD_CUSTOM_VALIDATION_EXCEPTION: rejected by rule");
        }
        String uniqueField = uniqueFields.get(entityType);
        if (uniqueField != null && payload.get(uniqueField) != null) {
            Object value = payload.get(uniqueField);
            for (var existing : records.getOrDefault(entityType, Map.of()).entrySet()) {
                if (Objects.equals(existing.getValue().get(uniqueField), value)) {
                    throw new DuplicateRecordException(entityType, existing.getKey(),
                        "DUPLICATE_VALUE: duplicate value found: " + uniqueField + " duplicates value on record with id: "
                            + existing.getKey());
                }
            }
        }
    }

    private void validateUpdate(String entityType, String id, Map<String, Object> fields) {
        if (!records.getOrDefault(entityType, Map.of()).containsKey(id)) {
            throw new RecordStoreException(entityType, id, "ENTITY_IS_DELETED: no " + entityType + " " + id);
        }
        for (String rejected : rejectedUpdateFields.getOrDefault(entityType, Set.of())) {
            if (fields.containsKey(rejected)) {
                throw new RecordStoreException(entityType, id, "FIELD_INTEGRITY_EXCEPTION: " + rejected + " cannot be updated");
            }
        }
    }

    private String insert(String entityType, Map<String, Object> payload) {
        String prefix = entityType.length() >= 3 ? entityType.substring(0, 3).toUpperCase() : entityType.toUpperCase();
        String id = String.format("%s%012d", prefix, idSequence.incrementAndGet());
        records.computeIfAbsent(entityType, t -> new LinkedHashMap<>()).put(id, new LinkedHashMap<>(payload));
        log.debug("[{}] created {} {}", name, entityType, id);
        return id;
    }

    private static boolean consumeFailure(Map<String, Integer> failures, String entityType) {
        int remaining = failures.getOrDefault(entityType, 0);
        if (remaining <= 0) {
            return false;
        }
        failures.put(entityType, remaining - 1);
        return true;
    }

    private static Map<String, Object> nonNull(Map<String, Object> fields) {
        var copy = new LinkedHashMap<String, Object>();
        fields.forEach((k, v) -> {
            if (v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }
}
