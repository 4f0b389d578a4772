package org.sandcastle.migrations.snapshot;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.sandcastle.migrations.graph.ir.Snapshot;
import org.sandcastle.migrations.graph.ir.SourceRecord;
import org.sandcastle.migrations.graph.snapshot.SnapshotStore;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Snapshot log kept as one CSV file per entity type, {@code <type>_migration.csv}, in a single
 * directory. Rows are appended as Phase 1 creates records and read back whole by Phase 2 or by a
 * resumed run.
 */
@Slf4j
public class CsvSnapshotStore implements SnapshotStore {

    public static final String FILE_SUFFIX = "_migration.csv";

    private static final TypeReference<Map<String, Object>> RECORD_DATA = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> REFERENCES = new TypeReference<>() {};

    @Getter
    private final Path directory;
    private final CsvMapper csvMapper = new CsvMapper();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CsvSchema schema = CsvSchema.builder()
        .addColumn(SnapshotRow.SOURCE_ID)
        .addColumn(SnapshotRow.TARGET_ID)
        .addColumn(SnapshotRow.RECORD_DATA)
        .addColumn(SnapshotRow.WRITTEN_REFERENCES)
        .build();

    public CsvSnapshotStore(Path directory) {
        this.directory = directory;
    }

    public CsvSnapshotStore(String directory) {
        this(Path.of(directory));
    }

    public Path fileFor(String entityType) {
        return directory.resolve(entityType.toLowerCase(Locale.ROOT) + FILE_SUFFIX);
    }

    @Override
    public synchronized void appendSnapshot(Snapshot snapshot) throws IOException {
        Files.createDirectories(directory);
        Path file = fileFor(snapshot.entityType());
        boolean newFile = !Files.exists(file) || Files.size(file) == 0;
        var row = new SnapshotRow(
            snapshot.sourceId(),
            snapshot.targetId(),
            objectMapper.writeValueAsString(snapshot.record().fields()),
            objectMapper.writeValueAsString(snapshot.writtenReferences()));
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            csvMapper.writer(newFile ? schema.withHeader() : schema.withoutHeader()).writeValue(writer, row);
        }
        log.atDebug().setMessage("Logged {} {} -> {} to {}")
            .addArgument(snapshot.entityType()).addArgument(snapshot.sourceId())
            .addArgument(snapshot.targetId()).addArgument(file).log();
    }

    @Override
    public synchronized List<Snapshot> readSnapshots(String entityType) throws IOException {
        Path file = fileFor(entityType);
        if (!Files.exists(file)) {
            log.debug("No snapshot file for {} at {}", entityType, file);
            return List.of();
        }
        var snapshots = new ArrayList<Snapshot>();
        try (MappingIterator<SnapshotRow> rows = csvMapper.readerFor(SnapshotRow.class)
                .with(schema.withHeader())
                .readValues(file.toFile())) {
            while (rows.hasNextValue()) {
                SnapshotRow row = rows.nextValue();
                snapshots.add(toSnapshot(entityType, row));
            }
        }
        log.info("Read {} {} snapshots from {}", snapshots.size(), entityType, file);
        return snapshots;
    }

    private Snapshot toSnapshot(String entityType, SnapshotRow row) throws IOException {
        if (row.sourceId() == null || row.sourceId().isBlank() || row.targetId() == null || row.targetId().isBlank()) {
            throw new IOException("Snapshot row for " + entityType + " is missing an id: " + row);
        }
        Map<String, Object> fields = isBlank(row.recordData())
            ? Map.of()
            : objectMapper.readValue(row.recordData(), RECORD_DATA);
        Map<String, String> written = isBlank(row.writtenReferences())
            ? Map.of()
            : objectMapper.readValue(row.writtenReferences(), REFERENCES);
        return new Snapshot(entityType, row.sourceId(), row.targetId(),
            new SourceRecord(entityType, row.sourceId(), fields), written);
    }

    @Override
    public synchronized void clearSnapshots() throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                Files.delete(file);
                log.info("Cleared {}", file.getFileName());
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
