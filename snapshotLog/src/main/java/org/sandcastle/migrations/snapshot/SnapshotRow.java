package org.sandcastle.migrations.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One line of a {@code <type>_migration.csv} file. The record data and the written references are
 * stored as JSON text so a row stays a flat CSV line.
 */
@JsonPropertyOrder({ SnapshotRow.SOURCE_ID, SnapshotRow.TARGET_ID, SnapshotRow.RECORD_DATA, SnapshotRow.WRITTEN_REFERENCES })
record SnapshotRow(
    @JsonProperty(SOURCE_ID) String sourceId,
    @JsonProperty(TARGET_ID) String targetId,
    @JsonProperty(RECORD_DATA) String recordData,
    @JsonProperty(WRITTEN_REFERENCES) String writtenReferences
) {
    static final String SOURCE_ID = "source_id";
    static final String TARGET_ID = "target_id";
    static final String RECORD_DATA = "record_data";
    static final String WRITTEN_REFERENCES = "written_references";
}
