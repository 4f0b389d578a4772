package org.sandcastle.migrations.graph.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Named record schema with an ordered, read-only field set.
 */
public final class EntityType {

    private final String name;
    private final Map<String, FieldSpec> fields;

    public EntityType(String name, List<FieldSpec> fields) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity type name must be provided");
        }
        this.name = name;
        var byName = new LinkedHashMap<String, FieldSpec>();
        for (FieldSpec field : fields) {
            byName.put(field.name(), field);
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    public String name() {
        return name;
    }

    public List<FieldSpec> fields() {
        return List.copyOf(fields.values());
    }

    public Optional<FieldSpec> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public List<FieldSpec> referenceFields() {
        return fields.values().stream().filter(FieldSpec::isReference).collect(Collectors.toList());
    }

    /** Reference fields pointing back at this same entity type (parent/partner style links). */
    public List<FieldSpec> selfReferenceFields() {
        return fields.values().stream()
            .filter(f -> f.isReference() && name.equals(f.referencedType()))
            .collect(Collectors.toList());
    }

    public List<FieldSpec> requiredFields() {
        return fields.values().stream().filter(FieldSpec::required).collect(Collectors.toList());
    }

    public Set<String> immutableFieldNames() {
        return fields.values().stream()
            .filter(FieldSpec::immutableAfterCreate)
            .map(FieldSpec::name)
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String toString() {
        return "EntityType{" + name + ", fields=" + fields.keySet() + '}';
    }
}
