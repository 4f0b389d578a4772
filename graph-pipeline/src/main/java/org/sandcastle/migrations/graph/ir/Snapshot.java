package org.sandcastle.migrations.graph.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted outcome of one Phase 1 creation: the verbatim source record, the target id it
 * ended up with, and the reference values actually written when it was created.
 */
public record Snapshot(
    String entityType,
    String sourceId,
    String targetId,
    SourceRecord record,
    Map<String, String> writtenReferences
) {
    public Snapshot {
        writtenReferences = Collections.unmodifiableMap(
            new LinkedHashMap<>(writtenReferences != null ? writtenReferences : Map.of()));
    }
}
