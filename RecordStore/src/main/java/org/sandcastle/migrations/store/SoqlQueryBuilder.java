package org.sandcastle.migrations.store;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.sandcastle.migrations.graph.store.RecordQuery;

/**
 * Renders a {@link RecordQuery} as a SOQL statement.
 */
final class SoqlQueryBuilder {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_.]*");

    private SoqlQueryBuilder() {}

    static String select(RecordQuery query, Collection<String> fields) {
        var selected = new LinkedHashSet<String>();
        selected.add(RecordQuery.ID_FIELD);
        fields.forEach(f -> selected.add(identifier(f)));

        var soql = new StringBuilder("SELECT ")
            .append(String.join(", ", selected))
            .append(" FROM ")
            .append(identifier(query.entityType()));
        List<String> conditions = query.anyOf().stream()
            .filter(c -> !c.values().isEmpty())
            .map(c -> identifier(c.field()) + " IN ("
                + c.values().stream().map(SoqlQueryBuilder::literal).collect(Collectors.joining(", ")) + ")")
            .collect(Collectors.toList());
        if (conditions.size() == 1) {
            soql.append(" WHERE ").append(conditions.get(0));
        } else if (conditions.size() > 1) {
            soql.append(" WHERE ").append(conditions.stream().map(c -> "(" + c + ")").collect(Collectors.joining(" OR ")));
        }
        if (query.isLimited()) {
            soql.append(" LIMIT ").append(query.limit());
        }
        return soql.toString();
    }

    static String recordTypeByDeveloperName(String sobjectType, String developerName) {
        return "SELECT Id FROM RecordType WHERE SobjectType = " + literal(sobjectType)
            + " AND DeveloperName = " + literal(developerName) + " LIMIT 1";
    }

    static String recordTypeById(String recordTypeId) {
        return "SELECT Id, DeveloperName FROM RecordType WHERE Id = " + literal(recordTypeId) + " LIMIT 1";
    }

    /** Quoted string literal; {@code true}/{@code false} are emitted as boolean literals. */
    static String literal(String value) {
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return value.toLowerCase(Locale.ROOT);
        }
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid field or entity name: " + name);
        }
        return name;
    }
}
