package org.sandcastle.migrations.graph.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A record as read from the source store. Reference values are raw source identifiers.
 * Field values may be null; the field map is read-only.
 */
public record SourceRecord(
    String entityType,
    String id,
    Map<String, Object> fields
) {
    public SourceRecord {
        if (entityType == null || id == null) {
            throw new IllegalArgumentException("Source record needs an entity type and an id");
        }
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields != null ? fields : Map.of()));
    }

    public Object get(String fieldName) {
        return fields.get(fieldName);
    }

    /**
     * Raw source id held by a reference field, or null when the field is absent, null or
     * holds a nested relationship object instead of an id.
     */
    public String reference(String fieldName) {
        Object value = fields.get(fieldName);
        if (value instanceof String) {
            String s = (String) value;
            return s.isBlank() ? null : s;
        }
        return null;
    }
}
