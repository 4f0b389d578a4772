package org.sandcastle.migrations.graph.ir;

import java.util.Set;

/**
 * One insertable field of an entity type, as reported by metadata introspection.
 *
 * Scalar fields may carry an enumerated value domain in {@code allowedValues};
 * an empty set means the field is unconstrained.
 */
public record FieldSpec(
    String name,
    FieldKind kind,
    String referencedType,
    ValueType valueType,
    boolean required,
    boolean immutableAfterCreate,
    boolean multiValued,
    Set<String> allowedValues
) {
    public enum FieldKind {
        SCALAR,
        REFERENCE
    }

    /** What a scalar value holds, as far as payload sanitation cares. */
    public enum ValueType {
        TEXT,
        BOOLEAN,
        EMAIL
    }

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name must be provided");
        }
        if (kind == FieldKind.REFERENCE && (referencedType == null || referencedType.isBlank())) {
            throw new IllegalArgumentException("Reference field " + name + " has no referenced type");
        }
        valueType = valueType != null ? valueType : ValueType.TEXT;
        allowedValues = allowedValues != null ? Set.copyOf(allowedValues) : Set.of();
    }

    public static FieldSpec scalar(String name) {
        return scalar(name, false);
    }

    public static FieldSpec scalar(String name, boolean required) {
        return new FieldSpec(name, FieldKind.SCALAR, null, ValueType.TEXT, required, false, false, Set.of());
    }

    public static FieldSpec typed(String name, ValueType valueType) {
        return new FieldSpec(name, FieldKind.SCALAR, null, valueType, false, false, false, Set.of());
    }

    public static FieldSpec enumerated(String name, boolean multiValued, Set<String> allowedValues) {
        return new FieldSpec(name, FieldKind.SCALAR, null, ValueType.TEXT, false, false, multiValued, allowedValues);
    }

    public static FieldSpec reference(String name, String referencedType, boolean required) {
        return new FieldSpec(name, FieldKind.REFERENCE, referencedType, ValueType.TEXT, required, false, false, Set.of());
    }

    public static FieldSpec immutableReference(String name, String referencedType, boolean required) {
        return new FieldSpec(name, FieldKind.REFERENCE, referencedType, ValueType.TEXT, required, true, false, Set.of());
    }

    public FieldSpec asRequired() {
        return new FieldSpec(name, kind, referencedType, valueType, true, immutableAfterCreate, multiValued, allowedValues);
    }

    public boolean isReference() {
        return kind == FieldKind.REFERENCE;
    }

    public boolean isEnumerated() {
        return kind == FieldKind.SCALAR && !allowedValues.isEmpty();
    }
}
