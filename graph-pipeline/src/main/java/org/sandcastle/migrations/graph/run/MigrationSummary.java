package org.sandcastle.migrations.graph.run;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

import org.sandcastle.migrations.graph.RecordFailure;
import org.sandcastle.migrations.graph.RunStatistics;
import org.sandcastle.migrations.graph.RunStatistics.Counter;

/**
 * End-of-run report: outcome counts per entity type and every contained failure.
 */
public record MigrationSummary(
    List<Row> rows,
    List<RecordFailure> failures,
    int dummiesPurged,
    Duration elapsed
) {
    public record Row(String entityType, int created, int adopted, int failed, int updated, int skipped, int errored) {}

    private static final String ROW_FORMAT = "%-28s %8s %8s %8s %8s %8s %8s";

    public MigrationSummary {
        rows = List.copyOf(rows);
        failures = List.copyOf(failures);
    }

    public static MigrationSummary from(RunStatistics statistics, List<String> entityTypes, int dummiesPurged, Duration elapsed) {
        var types = new LinkedHashSet<>(entityTypes);
        types.addAll(statistics.entityTypes());
        var rows = types.stream()
            .map(type -> new Row(type,
                statistics.get(type, Counter.CREATED),
                statistics.get(type, Counter.ADOPTED),
                statistics.get(type, Counter.FAILED),
                statistics.get(type, Counter.UPDATED),
                statistics.get(type, Counter.SKIPPED),
                statistics.get(type, Counter.ERRORED)))
            .collect(Collectors.toList());
        return new MigrationSummary(rows, statistics.getFailures(), dummiesPurged, elapsed);
    }

    public Row rowOf(String entityType) {
        return rows.stream().filter(r -> r.entityType().equals(entityType)).findFirst()
            .orElse(new Row(entityType, 0, 0, 0, 0, 0, 0));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public String toTable() {
        var sb = new StringBuilder();
        sb.append(String.format(ROW_FORMAT, "Entity type", "created", "adopted", "failed", "updated", "skipped", "errors"))
            .append(System.lineSeparator());
        for (Row row : rows) {
            sb.append(String.format(ROW_FORMAT, row.entityType(), row.created(), row.adopted(), row.failed(),
                row.updated(), row.skipped(), row.errored())).append(System.lineSeparator());
        }
        sb.append(String.format("%d failure(s), %d placeholder(s) purged, took %ds",
            failures.size(), dummiesPurged, elapsed.toSeconds()));
        return sb.toString();
    }
}
