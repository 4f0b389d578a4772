package org.sandcastle.migrations.store;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.sandcastle.migrations.graph.ir.FieldSpec;
import org.sandcastle.migrations.graph.ir.FieldSpec.FieldKind;
import org.sandcastle.migrations.graph.ir.FieldSpec.ValueType;
import org.sandcastle.migrations.graph.ir.SourceRecord;
import org.sandcastle.migrations.graph.ir.UpdatePayload;
import org.sandcastle.migrations.graph.metadata.EntityMetadataProvider;
import org.sandcastle.migrations.graph.store.BulkOperationException;
import org.sandcastle.migrations.graph.store.DuplicateRecordException;
import org.sandcastle.migrations.graph.store.RecordQuery;
import org.sandcastle.migrations.graph.store.RecordSource;
import org.sandcastle.migrations.graph.store.RecordStoreException;
import org.sandcastle.migrations.graph.store.RecordTarget;
import org.sandcastle.migrations.store.http.HttpResponse;
import org.sandcastle.migrations.store.http.RestClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Record store reached over an "sobjects"-style REST API.
 *
 * <ul>
 *   <li>{@code GET sobjects/{type}/{id}} and {@code GET query?q=} (following {@code nextRecordsUrl}) for reads</li>
 *   <li>{@code POST sobjects/{type}}, {@code PATCH|DELETE sobjects/{type}/{id}} for single writes</li>
 *   <li>{@code POST|PATCH composite/sobjects} with {@code allOrNone=false} for bulk writes; results are positional</li>
 *   <li>{@code GET sobjects/{type}/describe} for field metadata</li>
 * </ul>
 */
@Slf4j
public class RestRecordStore implements RecordSource, RecordTarget, EntityMetadataProvider {
    public static final int COMPOSITE_BATCH_LIMIT = 200;

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {};
    private static final String ATTRIBUTES = "attributes";

    @Getter
    private final RestClient client;
    private final String apiPath;
    private final Map<String, List<FieldSpec>> describeCache = new ConcurrentHashMap<>();

    public RestRecordStore(RestClient client) {
        this.client = client;
        this.apiPath = client.getConnectionContext().getApiPath();
    }

    @Override
    public Optional<String> endpoint() {
        return Optional.of(client.getConnectionContext().getUri().toString());
    }

    @Override
    public void close() {
        client.close();
    }

    @Override
    public Mono<SourceRecord> fetchRecord(String entityType, String id) {
        return client.getAsync(sobjectPath(entityType, id))
            .flatMap(response -> {
                if (response.getStatusCode() == 404) {
                    log.debug("{} {} not found", entityType, id);
                    return Mono.empty();
                }
                return Mono.just(toSourceRecord(entityType, readJson(entityType, id, requireSuccess(entityType, id, response))));
            });
    }

    @Override
    public Flux<SourceRecord> queryRecords(RecordQuery query) {
        if (query.isEmptySelection()) {
            return Flux.empty();
        }
        return describeFields(query.entityType())
            .map(fields -> SoqlQueryBuilder.select(query, fields.stream().map(FieldSpec::name).collect(Collectors.toList())))
            .flatMapMany(soql -> query(query.entityType(), soql))
            .map(node -> toSourceRecord(query.entityType(), node));
    }

    @Override
    public Flux<String> queryIds(RecordQuery query) {
        if (query.isEmptySelection()) {
            return Flux.empty();
        }
        return query(query.entityType(), SoqlQueryBuilder.select(query, List.of()))
            .map(node -> node.path(RecordQuery.ID_FIELD).asText());
    }

    @Override
    public Mono<String> createRecord(String entityType, Map<String, Object> payload) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(payload))
            .flatMap(body -> client.postAsync(apiPath + "/sobjects/" + entityType, body))
            .map(response -> {
                if (!response.isSuccess()) {
                    List<ApiError> errors = ApiError.parse(objectMapper, response.getBody());
                    if (ApiError.anyDuplicate(errors)) {
                        throw new DuplicateRecordException(entityType, ApiError.duplicateId(errors).orElse(null),
                            "Create of " + entityType + " refused: " + ApiError.describe(errors));
                    }
                    throw failure(entityType, null, "create", response);
                }
                String id = readJson(entityType, null, response.getBody()).path("id").asText(null);
                if (id == null) {
                    throw new RecordStoreException(entityType, null, "Create of " + entityType + " returned no id");
                }
                return id;
            });
    }

    @Override
    public Mono<List<String>> bulkCreate(String entityType, List<Map<String, Object>> payloads) {
        var records = new ArrayList<ObjectNode>();
        for (Map<String, Object> payload : payloads) {
            ObjectNode record = objectMapper.valueToTree(payload);
            records.add(withType(entityType, record));
        }
        return compositeWrite(entityType, "create", records, "POST")
            .map(results -> {
                var ids = results.stream().map(SaveResult::id).collect(Collectors.toList());
                List<SaveResult> failed = results.stream().filter(r -> !r.success()).collect(Collectors.toList());
                if (!failed.isEmpty()) {
                    throw new BulkOperationException(entityType,
                        failed.size() + " of " + results.size() + " " + entityType + " creates failed, first: " + failed.get(0).message(),
                        ids);
                }
                return ids;
            });
    }

    @Override
    public Mono<Void> updateRecord(String entityType, String id, Map<String, Object> fields) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(fields))
            .flatMap(body -> client.patchAsync(sobjectPath(entityType, id), body))
            .doOnNext(response -> requireSuccess(entityType, id, "update", response))
            .then();
    }

    @Override
    public Mono<Void> bulkUpdate(String entityType, List<UpdatePayload> updates) {
        var records = new ArrayList<ObjectNode>();
        for (UpdatePayload update : updates) {
            ObjectNode record = objectMapper.valueToTree(update.fields());
            record.put(RecordQuery.ID_FIELD, update.targetId());
            records.add(withType(entityType, record));
        }
        return compositeWrite(entityType, "update", records, "PATCH")
            .doOnNext(results -> {
                List<SaveResult> failed = results.stream().filter(r -> !r.success()).collect(Collectors.toList());
                if (!failed.isEmpty()) {
                    var applied = new ArrayList<String>();
                    for (int i = 0; i < results.size(); i++) {
                        applied.add(results.get(i).success() ? updates.get(i).targetId() : null);
                    }
                    throw new BulkOperationException(entityType,
                        failed.size() + " of " + results.size() + " " + entityType + " updates failed, first: " + failed.get(0).message(),
                        applied);
                }
            })
            .then();
    }

    @Override
    public Mono<Void> deleteRecord(String entityType, String id) {
        return client.deleteAsync(sobjectPath(entityType, id))
            .doOnNext(response -> requireSuccess(entityType, id, "delete", response))
            .then();
    }

    /**
     * Createable fields of the type. Required means the store will reject a create without it:
     * not nillable, createable and not defaulted on create. Immutable means createable but not
     * updateable.
     */
    @Override
    public List<FieldSpec> describeEntity(String entityType) throws IOException {
        try {
            List<FieldSpec> fields = describeFields(entityType).block();
            return fields != null ? fields : List.of();
        } catch (RecordStoreException e) {
            throw new IOException("Describe of " + entityType + " failed: " + e.getMessage(), e);
        }
    }

    Mono<List<FieldSpec>> describeFields(String entityType) {
        List<FieldSpec> cached = describeCache.get(entityType);
        if (cached != null) {
            return Mono.just(cached);
        }
        return client.getAsync(apiPath + "/sobjects/" + entityType + "/describe")
            .map(response -> toFieldSpecs(entityType, readJson(entityType, null, requireSuccess(entityType, null, response))))
            .doOnNext(fields -> describeCache.put(entityType, fields));
    }

    /** Developer name of a record type, empty when there is no such record type. */
    Mono<String> recordTypeDeveloperName(String recordTypeId) {
        return query("RecordType", SoqlQueryBuilder.recordTypeById(recordTypeId))
            .next()
            .flatMap(node -> Mono.justOrEmpty(node.path("DeveloperName").asText(null)));
    }

    /** Record type of the given entity type carrying the developer name, empty when there is none. */
    Mono<String> recordTypeId(String sobjectType, String developerName) {
        return query("RecordType", SoqlQueryBuilder.recordTypeByDeveloperName(sobjectType, developerName))
            .next()
            .flatMap(node -> Mono.justOrEmpty(node.path(RecordQuery.ID_FIELD).asText(null)));
    }

    private Flux<JsonNode> query(String entityType, String soql) {
        log.atDebug().setMessage("Query: {}").addArgument(soql).log();
        String first = apiPath + "/query?q=" + URLEncoder.encode(soql, StandardCharsets.UTF_8);
        return fetchPage(entityType, first)
            .expand(page -> {
                String next = page.path("nextRecordsUrl").asText(null);
                return page.path("done").asBoolean(true) || next == null ? Mono.empty() : fetchPage(entityType, next);
            })
            .concatMapIterable(page -> {
                var records = new ArrayList<JsonNode>();
                page.path("records").forEach(records::add);
                return records;
            });
    }

    private Mono<JsonNode> fetchPage(String entityType, String path) {
        return client.getAsync(path)
            .map(response -> readJson(entityType, null, requireSuccess(entityType, null, response)));
    }

    /**
     * Sends the records in chunks the API accepts. A chunk that fails as a whole yields failed
     * results for its records so the positions of the other chunks are kept.
     */
    private Mono<List<SaveResult>> compositeWrite(String entityType, String operation, List<ObjectNode> records, String method) {
        if (records.isEmpty()) {
            return Mono.just(List.of());
        }
        return Flux.fromIterable(records)
            .buffer(COMPOSITE_BATCH_LIMIT)
            .concatMap(chunk -> {
                ObjectNode body = objectMapper.createObjectNode();
                body.put("allOrNone", false);
                ArrayNode array = body.putArray("records");
                chunk.forEach(array::add);
                String json = body.toString();
                Mono<HttpResponse> call = "PATCH".equals(method)
                    ? client.patchAsync(apiPath + "/composite/sobjects", json)
                    : client.postAsync(apiPath + "/composite/sobjects", json);
                return call
                    .map(response -> toSaveResults(entityType, operation, chunk.size(), response))
                    .onErrorResume(e -> !(e instanceof Error), e -> {
                        log.atWarn().setMessage("Composite {} of {} {} records failed")
                            .addArgument(operation).addArgument(chunk.size()).addArgument(entityType).setCause(e).log();
                        return Mono.just(failedResults(chunk.size(), e.getMessage()));
                    });
            })
            .concatMapIterable(results -> results)
            .collectList();
    }

    private List<SaveResult> toSaveResults(String entityType, String operation, int expected, HttpResponse response) {
        if (!response.isSuccess()) {
            return failedResults(expected, failure(entityType, null, operation, response).getMessage());
        }
        JsonNode node = readJson(entityType, null, response.getBody());
        if (!node.isArray() || node.size() != expected) {
            return failedResults(expected, "Composite " + operation + " returned " + node.size() + " results for " + expected + " records");
        }
        var results = new ArrayList<SaveResult>();
        for (JsonNode result : node) {
            boolean success = result.path("success").asBoolean(false);
            String message = success ? null : ApiError.describe(ApiError.fromNode(result.path("errors")));
            results.add(new SaveResult(success ? result.path("id").asText(null) : null, success, message));
        }
        return results;
    }

    private static List<SaveResult> failedResults(int count, String message) {
        var results = new ArrayList<SaveResult>();
        for (int i = 0; i < count; i++) {
            results.add(new SaveResult(null, false, message));
        }
        return results;
    }

    private static ObjectNode withType(String entityType, ObjectNode record) {
        ObjectNode typed = objectMapper.createObjectNode();
        typed.putObject(ATTRIBUTES).put("type", entityType);
        typed.setAll(record);
        return typed;
    }

    private static List<FieldSpec> toFieldSpecs(String entityType, JsonNode describe) {
        var fields = new ArrayList<FieldSpec>();
        for (JsonNode field : describe.path("fields")) {
            if (!field.path("createable").asBoolean(false)) {
                continue;
            }
            String name = field.path("name").asText();
            String type = field.path("type").asText("string");
            boolean required = !field.path("nillable").asBoolean(true) && !field.path("defaultedOnCreate").asBoolean(false);
            boolean immutable = !field.path("updateable").asBoolean(true);
            if ("reference".equals(type)) {
                JsonNode referenceTo = field.path("referenceTo");
                if (referenceTo.size() == 0) {
                    continue;
                }
                if (referenceTo.size() > 1) {
                    log.debug("{}.{} references {}, following {}", entityType, name, referenceTo, referenceTo.get(0).asText());
                }
                fields.add(new FieldSpec(name, FieldKind.REFERENCE, referenceTo.get(0).asText(), ValueType.TEXT,
                    required, immutable, false, null));
                continue;
            }
            var allowed = new LinkedHashSet<String>();
            for (JsonNode value : field.path("picklistValues")) {
                if (value.path("active").asBoolean(true)) {
                    allowed.add(value.path("value").asText());
                }
            }
            ValueType valueType = "email".equals(type) ? ValueType.EMAIL
                : "boolean".equals(type) ? ValueType.BOOLEAN
                : ValueType.TEXT;
            boolean enumerated = "picklist".equals(type) || "multipicklist".equals(type);
            fields.add(new FieldSpec(name, FieldKind.SCALAR, null, valueType, required, immutable,
                "multipicklist".equals(type), enumerated ? allowed : null));
        }
        log.info("Described {}: {} createable fields", entityType, fields.size());
        return fields;
    }

    private static SourceRecord toSourceRecord(String entityType, JsonNode node) {
        Map<String, Object> fields = objectMapper.convertValue(node, FIELD_MAP);
        fields.remove(ATTRIBUTES);
        Object id = fields.get(RecordQuery.ID_FIELD);
        if (id == null) {
            throw new RecordStoreException(entityType, null, "Record of " + entityType + " has no Id");
        }
        return new SourceRecord(entityType, id.toString(), fields);
    }

    private String sobjectPath(String entityType, String id) {
        return apiPath + "/sobjects/" + entityType + "/" + URLEncoder.encode(id, StandardCharsets.UTF_8);
    }

    private static String requireSuccess(String entityType, String id, HttpResponse response) {
        return requireSuccess(entityType, id, "read", response);
    }

    private static String requireSuccess(String entityType, String id, String operation, HttpResponse response) {
        if (!response.isSuccess()) {
            throw failure(entityType, id, operation, response);
        }
        return response.getBody();
    }

    private static RecordStoreException failure(String entityType, String id, String operation, HttpResponse response) {
        String errors = ApiError.describe(ApiError.parse(objectMapper, response.getBody()));
        return new RecordStoreException(entityType, id, operation + " of " + entityType + (id != null ? " " + id : "")
            + " failed with " + response.getStatusCode() + " " + response.getStatusText()
            + (errors.isEmpty() ? "" : ": " + errors));
    }

    private static JsonNode readJson(String entityType, String id, String body) {
        try {
            return objectMapper.readTree(body == null ? "null" : body);
        } catch (JsonProcessingException e) {
            throw new RecordStoreException(entityType, id, "Unreadable response for " + entityType + ": " + e.getOriginalMessage(), e);
        }
    }

    private record SaveResult(String id, boolean success, String message) {}
}
