package org.sandcastle.migrations.graph.identity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configured field values for one placeholder record, on top of what its metadata requires.
 * {@code dummyReferences} maps a field to the entity type whose placeholder it should point at.
 */
public record DummyTemplate(
    Map<String, Object> values,
    Map<String, String> dummyReferences
) {
    public DummyTemplate {
        values = Map.copyOf(values != null ? values : Map.of());
        dummyReferences = Map.copyOf(dummyReferences != null ? dummyReferences : Map.of());
    }

    public static DummyTemplate empty() {
        return new DummyTemplate(Map.of(), Map.of());
    }

    public static DummyTemplate of(Map<String, Object> values) {
        return new DummyTemplate(values, Map.of());
    }

    public DummyTemplate withDummyReference(String fieldName, String entityType) {
        var refs = new LinkedHashMap<>(dummyReferences);
        refs.put(fieldName, entityType);
        return new DummyTemplate(values, refs);
    }
}
