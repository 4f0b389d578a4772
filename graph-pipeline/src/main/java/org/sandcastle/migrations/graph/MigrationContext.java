package org.sandcastle.migrations.graph;

import org.sandcastle.migrations.graph.identity.DummyRegistry;
import org.sandcastle.migrations.graph.identity.IdentityContinuityResolver;
import org.sandcastle.migrations.graph.identity.IdentityMap;
import org.sandcastle.migrations.graph.identity.StableNameCache;
import org.sandcastle.migrations.graph.metadata.EntityMetadata;
import org.sandcastle.migrations.graph.rewrite.ReferenceRewriter;
import org.sandcastle.migrations.graph.rewrite.ScalarFieldSanitizer;
import org.sandcastle.migrations.graph.snapshot.SnapshotStore;
import org.sandcastle.migrations.graph.store.RecordSource;
import org.sandcastle.migrations.graph.store.RecordTarget;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Everything one run shares between its phases. Caches live here, not in static state,
 * so they start empty with every run.
 */
@Getter
@Builder
public class MigrationContext {
    @NonNull
    private final RecordSource source;
    @NonNull
    private final RecordTarget target;
    @NonNull
    private final EntityMetadata metadata;
    @NonNull
    private final IdentityMap identityMap;
    @NonNull
    private final DummyRegistry dummies;
    @NonNull
    private final SnapshotStore snapshots;
    @Builder.Default
    private final IdentityContinuityResolver continuity = IdentityContinuityResolver.none();
    @Builder.Default
    private final StableNameCache stableNames = StableNameCache.none();
    @Builder.Default
    private final RunStatistics statistics = new RunStatistics();
    @Builder.Default
    private final MigrationSettings settings = MigrationSettings.defaults();

    public ReferenceRewriter newRewriter() {
        return new ReferenceRewriter(metadata, identityMap, dummies, continuity, stableNames,
            new ScalarFieldSanitizer(settings.isMaskEmails()));
    }
}
