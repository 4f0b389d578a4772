package org.sandcastle.migrations.graph.identity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.sandcastle.migrations.graph.FatalSetupException;
import org.sandcastle.migrations.graph.ir.EntityType;
import org.sandcastle.migrations.graph.ir.FieldSpec;
import org.sandcastle.migrations.graph.metadata.EntityMetadata;
import org.sandcastle.migrations.graph.store.RecordTarget;

import lombok.extern.slf4j.Slf4j;

/**
 * One placeholder target record per entity type, standing in for required references whose
 * real counterpart is not migrated yet.
 *
 * Each placeholder is created at most once per run; the id registered for a type never changes.
 * Placeholders for required references of a placeholder are created first.
 */
@Slf4j
public class DummyRegistry {

    public static final String LABEL_PREFIX = "NO ";
    private static final List<String> LABEL_FIELDS = List.of("Name", "LastName", "Subject");

    public record PurgeResult(int deleted, int failed) {}

    private final RecordTarget target;
    private final EntityMetadata metadata;
    private final Map<String, DummyTemplate> templates;
    private final IdentityContinuityResolver continuity;
    private final Duration timeout;

    private final Map<String, String> dummies = new LinkedHashMap<>();
    private final Set<String> inProgress = new HashSet<>();

    public DummyRegistry(RecordTarget target,
                         EntityMetadata metadata,
                         Map<String, DummyTemplate> templates,
                         IdentityContinuityResolver continuity,
                         Duration timeout) {
        this.target = target;
        this.metadata = metadata;
        this.templates = Map.copyOf(templates);
        this.continuity = continuity;
        this.timeout = timeout;
    }

    /**
     * The placeholder id for a type, creating the placeholder on first use.
     *
     * @throws FatalSetupException if the placeholder cannot be built or created
     */
    public synchronized String ensure(String entityType) {
        String existing = dummies.get(entityType);
        if (existing != null) {
            return existing;
        }
        if (!inProgress.add(entityType)) {
            throw new FatalSetupException("Placeholders have circular required references through " + entityType);
        }
        try {
            Map<String, Object> payload = buildPayload(entityType);
            log.info("Creating placeholder {} record {}", entityType, payload);
            String id;
            try {
                id = target.createRecord(entityType, payload).block(timeout);
            } catch (RuntimeException e) {
                throw new FatalSetupException("Failed to create placeholder " + entityType + " record: " + e.getMessage(), e);
            }
            if (id == null) {
                throw new FatalSetupException("Target returned no id for placeholder " + entityType);
            }
            dummies.put(entityType, id);
            log.info("Placeholder {} created: {}", entityType, id);
            return id;
        } finally {
            inProgress.remove(entityType);
        }
    }

    public void ensureAll(Collection<String> entityTypes) {
        for (String entityType : entityTypes) {
            if (!continuity.handles(entityType)) {
                ensure(entityType);
            }
        }
        log.info("{} placeholder record(s) ready: {}", dummies.size(), dummies);
    }

    public synchronized Optional<String> lookup(String entityType) {
        return Optional.ofNullable(dummies.get(entityType));
    }

    public synchronized boolean isDummy(String entityType, String targetId) {
        return targetId != null && targetId.equals(dummies.get(entityType));
    }

    public synchronized Map<String, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(dummies));
    }

    /**
     * Delete every placeholder except the one for {@code keepType}, most recently created first
     * so dependents go before what they reference. Failures are logged and counted.
     */
    public synchronized PurgeResult purgeExcept(String keepType) {
        var order = new ArrayList<>(dummies.entrySet());
        Collections.reverse(order);
        int deleted = 0;
        int failed = 0;
        for (var entry : order) {
            if (entry.getKey().equals(keepType)) {
                continue;
            }
            try {
                target.deleteRecord(entry.getKey(), entry.getValue()).block(timeout);
                log.info("Deleted placeholder {} {}", entry.getKey(), entry.getValue());
                deleted++;
            } catch (RuntimeException e) {
                log.atWarn().setMessage("Failed to delete placeholder {} {}")
                    .addArgument(entry.getKey()).addArgument(entry.getValue()).setCause(e).log();
                failed++;
            }
        }
        return new PurgeResult(deleted, failed);
    }

    Map<String, Object> buildPayload(String entityType) {
        DummyTemplate template = templates.getOrDefault(entityType, DummyTemplate.empty());
        var payload = new LinkedHashMap<String, Object>(template.values());
        template.dummyReferences().forEach((field, referencedType) -> payload.put(field, ensure(referencedType)));

        if (!metadata.knows(entityType)) {
            if (payload.isEmpty()) {
                throw new FatalSetupException("No metadata or template to build a placeholder " + entityType);
            }
            return payload;
        }
        EntityType type = metadata.describe(entityType);
        for (FieldSpec field : type.requiredFields()) {
            if (payload.containsKey(field.name())) {
                continue;
            }
            if (field.isReference() && entityType.equals(field.referencedType())) {
                log.warn("Placeholder {} leaves out its required self reference {}", entityType, field.name());
                continue;
            }
            payload.put(field.name(), field.isReference()
                ? requiredReferenceValue(entityType, field)
                : placeholderValue(entityType, field));
        }
        if (LABEL_FIELDS.stream().noneMatch(payload::containsKey)) {
            LABEL_FIELDS.stream().filter(type::hasField).findFirst()
                .ifPresent(labelField -> payload.put(labelField, label(entityType)));
        }
        return payload;
    }

    private Object requiredReferenceValue(String entityType, FieldSpec field) {
        String referencedType = field.referencedType();
        if (continuity.handles(referencedType)) {
            return continuity.fallbackIdentity(referencedType).orElseThrow(() -> new FatalSetupException(
                "Placeholder " + entityType + " needs " + field.name() + " but no " + referencedType + " fallback is known"));
        }
        return ensure(referencedType);
    }

    private static Object placeholderValue(String entityType, FieldSpec field) {
        if (field.isEnumerated()) {
            return new TreeSet<>(field.allowedValues()).first();
        }
        switch (field.valueType()) {
            case BOOLEAN:
                return Boolean.FALSE;
            case EMAIL:
                return "placeholder." + entityType.toLowerCase() + "@example.invalid";
            default:
                return label(entityType);
        }
    }

    static String label(String entityType) {
        return LABEL_PREFIX + entityType.toUpperCase();
    }
}
