package org.sandcastle.migrations.graph;

import java.time.Duration;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tunables of one migration run.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class MigrationSettings {
    /** Payloads per bulk request. Lower it for wide entity types to stay under request size limits. */
    @Builder.Default
    private final int batchSize = 200;
    /** Longest wait for any single call to a store, bulk or not. */
    @Builder.Default
    private final Duration flushTimeout = Duration.ofMinutes(10);
    /** How many times a failed bulk flush is submitted before falling back to single records. */
    @Builder.Default
    private final int flushAttempts = 1;
    @Builder.Default
    private final boolean batchedCreation = true;
    @Builder.Default
    private final boolean resolveSameTypeDependencies = true;
    @Builder.Default
    private final boolean purgeDummies = true;
    @Builder.Default
    private final boolean deleteExisting = true;
    @Builder.Default
    private final boolean resume = false;
    @Builder.Default
    private final boolean maskEmails = true;

    public static MigrationSettings defaults() {
        return MigrationSettings.builder().build();
    }
}
