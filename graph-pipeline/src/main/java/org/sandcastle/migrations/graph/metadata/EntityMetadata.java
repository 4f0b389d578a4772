package org.sandcastle.migrations.graph.metadata;

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.sandcastle.migrations.graph.FatalSetupException;
import org.sandcastle.migrations.graph.ir.EntityType;
import org.sandcastle.migrations.graph.ir.FieldSpec;

import lombok.extern.slf4j.Slf4j;

/**
 * Read-only table of entity types, loaded once before any materialization begins.
 * Schema changes in the stores after loading are not picked up.
 */
@Slf4j
public final class EntityMetadata {

    private final Map<String, EntityType> types;

    private EntityMetadata(Map<String, EntityType> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public static EntityMetadata of(EntityType... entityTypes) {
        var byName = new LinkedHashMap<String, EntityType>();
        for (EntityType type : entityTypes) {
            byName.put(type.name(), type);
        }
        return new EntityMetadata(byName);
    }

    /**
     * Describe every named type through the provider.
     *
     * @throws FatalSetupException if any type cannot be described or has no fields
     */
    public static EntityMetadata load(EntityMetadataProvider provider, Collection<String> entityTypes) {
        var byName = new LinkedHashMap<String, EntityType>();
        for (String typeName : entityTypes) {
            List<FieldSpec> fields;
            try {
                fields = provider.describeEntity(typeName);
            } catch (IOException | RuntimeException e) {
                throw new FatalSetupException("Could not load metadata for " + typeName + ": " + e.getMessage(), e);
            }
            if (fields == null || fields.isEmpty()) {
                throw new FatalSetupException("No field metadata available for " + typeName);
            }
            byName.put(typeName, new EntityType(typeName, fields));
            log.info("Loaded metadata for {}: {} fields, {} references",
                typeName, fields.size(), fields.stream().filter(FieldSpec::isReference).count());
        }
        return new EntityMetadata(byName);
    }

    public EntityType describe(String entityType) {
        EntityType type = types.get(entityType);
        if (type == null) {
            throw new FatalSetupException("No metadata loaded for entity type " + entityType);
        }
        return type;
    }

    public boolean knows(String entityType) {
        return types.containsKey(entityType);
    }

    public Set<String> typeNames() {
        return types.keySet();
    }

    /** Every entity type that some loaded type references through a required field. */
    public Set<String> requiredReferenceTargets() {
        var targets = new LinkedHashSet<String>();
        for (EntityType type : types.values()) {
            for (FieldSpec field : type.referenceFields()) {
                if (field.required()) {
                    targets.add(field.referencedType());
                }
            }
        }
        return targets;
    }
}
