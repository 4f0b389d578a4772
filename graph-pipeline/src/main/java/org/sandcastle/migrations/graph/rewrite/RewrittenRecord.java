package org.sandcastle.migrations.graph.rewrite;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A target-shaped creation payload and the reference values it carries, keyed by field.
 * The payload never holds the source id.
 */
public record RewrittenRecord(
    String entityType,
    String sourceId,
    Map<String, Object> payload,
    Map<String, String> writtenReferences
) {
    public RewrittenRecord {
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        writtenReferences = Collections.unmodifiableMap(new LinkedHashMap<>(writtenReferences));
    }
}
