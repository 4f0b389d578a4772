package org.sandcastle.migrations.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.sandcastle.migrations.graph.ir.FieldSpec;
import org.sandcastle.migrations.graph.ir.FieldSpec.FieldKind;
import org.sandcastle.migrations.graph.ir.FieldSpec.ValueType;
import org.sandcastle.migrations.graph.metadata.EntityMetadataProvider;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads field metadata exported ahead of time to {@code <type>Fields.csv} files.
 *
 * Required columns are {@code Field Name}, {@code Field Type} and {@code Reference To}; the
 * {@code Required}, {@code Immutable} and {@code Allowed Values} columns are optional. Allowed
 * values are {@code ;}-separated.
 */
@Slf4j
@RequiredArgsConstructor
public class CsvEntityMetadataProvider implements EntityMetadataProvider {

    public static final String FILE_SUFFIX = "Fields.csv";

    static final String FIELD_NAME = "Field Name";
    static final String FIELD_TYPE = "Field Type";
    static final String REFERENCE_TO = "Reference To";
    static final String REQUIRED = "Required";
    static final String IMMUTABLE = "Immutable";
    static final String ALLOWED_VALUES = "Allowed Values";

    private final Path directory;
    private final CsvMapper csvMapper = new CsvMapper();

    public CsvEntityMetadataProvider(String directory) {
        this(Path.of(directory));
    }

    public Path fileFor(String entityType) {
        return directory.resolve(entityType.toLowerCase(Locale.ROOT) + FILE_SUFFIX);
    }

    @Override
    public List<FieldSpec> describeEntity(String entityType) throws IOException {
        Path file = fileFor(entityType);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "No field metadata for " + entityType);
        }
        var fields = new ArrayList<FieldSpec>();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(file.toFile())) {
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                String name = trimmed(row.get(FIELD_NAME));
                if (name.isEmpty()) {
                    continue;
                }
                fields.add(toFieldSpec(entityType, name, row));
            }
        }
        log.debug("Read {} fields for {} from {}", fields.size(), entityType, file);
        return fields;
    }

    private static FieldSpec toFieldSpec(String entityType, String name, Map<String, String> row) throws IOException {
        String type = trimmed(row.get(FIELD_TYPE)).toLowerCase(Locale.ROOT);
        boolean required = flag(row.get(REQUIRED));
        boolean immutable = flag(row.get(IMMUTABLE));
        Set<String> allowed = splitValues(row.get(ALLOWED_VALUES));
        switch (type) {
            case "reference": {
                List<String> targets = Arrays.stream(trimmed(row.get(REFERENCE_TO)).split("[;,]"))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList());
                if (targets.isEmpty()) {
                    throw new IOException(entityType + "." + name + " is a reference without a Reference To value");
                }
                if (targets.size() > 1) {
                    log.warn("{}.{} references {}; only {} is followed", entityType, name, targets, targets.get(0));
                }
                return new FieldSpec(name, FieldKind.REFERENCE, targets.get(0), ValueType.TEXT,
                    required, immutable, false, Set.of());
            }
            case "picklist":
                return new FieldSpec(name, FieldKind.SCALAR, null, ValueType.TEXT, required, immutable, false, allowed);
            case "multipicklist":
                return new FieldSpec(name, FieldKind.SCALAR, null, ValueType.TEXT, required, immutable, true, allowed);
            case "email":
                return new FieldSpec(name, FieldKind.SCALAR, null, ValueType.EMAIL, required, immutable, false, Set.of());
            case "boolean":
                return new FieldSpec(name, FieldKind.SCALAR, null, ValueType.BOOLEAN, required, immutable, false, Set.of());
            default:
                return new FieldSpec(name, FieldKind.SCALAR, null, ValueType.TEXT, required, immutable, false, Set.of());
        }
    }

    private static Set<String> splitValues(String raw) {
        var values = new LinkedHashSet<String>();
        for (String value : trimmed(raw).split(";")) {
            if (!value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }

    private static boolean flag(String raw) {
        String value = trimmed(raw).toLowerCase(Locale.ROOT);
        return value.equals("true") || value.equals("yes") || value.equals("1");
    }

    private static String trimmed(String raw) {
        return raw == null ? "" : raw.trim();
    }
}
