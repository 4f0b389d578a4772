package org.sandcastle.migrations.graph.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Store-neutral filter: records of one entity type matching ANY of the conditions
 * (each condition being "field is one of N values"), optionally capped.
 * A query without conditions selects every record of the type.
 */
public record RecordQuery(
    String entityType,
    List<Condition> anyOf,
    int limit
) {
    public static final String ID_FIELD = "Id";
    public static final int NO_LIMIT = -1;

    public record Condition(String field, Set<String> values) {
        public Condition {
            values = new LinkedHashSet<>(values);
        }
    }

    public RecordQuery {
        anyOf = List.copyOf(anyOf);
    }

    public static RecordQuery all(String entityType) {
        return new RecordQuery(entityType, List.of(), NO_LIMIT);
    }

    public static RecordQuery byIds(String entityType, Collection<String> ids) {
        return new RecordQuery(entityType, List.of(new Condition(ID_FIELD, Set.copyOf(ids))), NO_LIMIT);
    }

    public static RecordQuery where(String entityType, String field, Collection<String> values) {
        return new RecordQuery(entityType, List.of(new Condition(field, new LinkedHashSet<>(values))), NO_LIMIT);
    }

    public static RecordQuery whereEquals(String entityType, String field, String value) {
        return where(entityType, field, List.of(value));
    }

    public RecordQuery or(String field, Collection<String> values) {
        var conditions = new ArrayList<>(anyOf);
        conditions.add(new Condition(field, new LinkedHashSet<>(values)));
        return new RecordQuery(entityType, conditions, limit);
    }

    public RecordQuery withLimit(int newLimit) {
        return new RecordQuery(entityType, anyOf, newLimit);
    }

    public boolean isLimited() {
        return limit >= 0;
    }

    /** True when a condition can never match, e.g. "field is one of {}". */
    public boolean isEmptySelection() {
        return !anyOf.isEmpty() && anyOf.stream().allMatch(c -> c.values().isEmpty());
    }
}
