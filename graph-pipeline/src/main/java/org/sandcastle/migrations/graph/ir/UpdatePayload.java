package org.sandcastle.migrations.graph.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field changes to apply to one existing target record.
 */
public record UpdatePayload(
    String targetId,
    Map<String, Object> fields
) {
    public UpdatePayload {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
