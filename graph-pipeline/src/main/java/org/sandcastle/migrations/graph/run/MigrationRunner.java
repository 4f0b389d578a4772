package org.sandcastle.migrations.graph.run;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.sandcastle.migrations.graph.FatalSetupException;
import org.sandcastle.migrations.graph.MigrationContext;
import org.sandcastle.migrations.graph.MigrationSettings;
import org.sandcastle.migrations.graph.RunStatistics;
import org.sandcastle.migrations.graph.identity.DummyRegistry;
import org.sandcastle.migrations.graph.identity.IdentityContinuityResolver;
import org.sandcastle.migrations.graph.identity.IdentityMap;
import org.sandcastle.migrations.graph.identity.StableNameCache;
import org.sandcastle.migrations.graph.ir.SourceRecord;
import org.sandcastle.migrations.graph.metadata.EntityMetadata;
import org.sandcastle.migrations.graph.metadata.EntityMetadataProvider;
import org.sandcastle.migrations.graph.phase1.GraphMaterializer;
import org.sandcastle.migrations.graph.phase2.BackpatchEngine;
import org.sandcastle.migrations.graph.run.MigrationPlan.ChildSpec;
import org.sandcastle.migrations.graph.snapshot.SnapshotStore;
import org.sandcastle.migrations.graph.snapshot.SnapshotStoreException;
import org.sandcastle.migrations.graph.store.RecordQuery;
import org.sandcastle.migrations.graph.store.RecordSource;
import org.sandcastle.migrations.graph.store.RecordTarget;
import org.sandcastle.migrations.graph.store.StableNameResolver;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * Drives one migration run from safety checks to the summary.
 *
 * Phase 1 runs for the roots (and what points at them), then for each child type in plan order,
 * with every batch flushed before the next step starts. Phase 2 runs per type in backpatch order.
 */
@Slf4j
@Builder
public class MigrationRunner {

    private static final int PARENT_IDS_PER_QUERY = 200;

    @NonNull
    private final RecordSource source;
    @NonNull
    private final RecordTarget target;
    @NonNull
    private final EntityMetadataProvider metadataProvider;
    @NonNull
    private final SnapshotStore snapshots;
    @NonNull
    private final MigrationPlan plan;
    @Builder.Default
    private final StableNameResolver stableNameResolver = StableNameResolver.NONE;
    @Builder.Default
    private final MigrationSettings settings = MigrationSettings.defaults();

    /**
     * @throws FatalSetupException when the run cannot start or cannot continue safely
     * @throws SnapshotStoreException when the snapshot log fails
     */
    public MigrationSummary run() {
        Instant started = Instant.now();
        log.info("Starting migration of {} {} root(s) with {}", plan.getRootIds().size(), plan.getRootEntityType(), settings);
        refuseSameStore();

        EntityMetadata metadata = EntityMetadata.load(metadataProvider, plan.metadataEntityTypes());
        if (settings.isDeleteExisting() && !settings.isResume()) {
            deleteExisting();
        }
        var identityMap = new IdentityMap();
        prepareSnapshots(identityMap);

        Duration timeout = settings.getFlushTimeout();
        var continuity = new IdentityContinuityResolver(target, plan.getContinuity(), timeout);
        var stableNames = new StableNameCache(stableNameResolver, plan.getStableNameTypes(), timeout);
        var dummies = new DummyRegistry(target, metadata, plan.getDummyTemplates(), continuity, timeout);
        var statistics = new RunStatistics();
        var context = MigrationContext.builder()
            .source(source)
            .target(target)
            .metadata(metadata)
            .identityMap(identityMap)
            .dummies(dummies)
            .snapshots(snapshots)
            .continuity(continuity)
            .stableNames(stableNames)
            .statistics(statistics)
            .settings(settings)
            .build();

        var dummyTypes = new LinkedHashSet<>(metadata.requiredReferenceTargets());
        dummyTypes.removeAll(plan.getStableNameTypes());
        dummies.ensureAll(dummyTypes);

        var materializer = new GraphMaterializer(context);
        materializeRoots(materializer, metadata);
        for (ChildSpec child : plan.getChildren()) {
            materializeChildren(materializer, identityMap, child);
        }
        materializer.flushAll();

        var backpatch = new BackpatchEngine(context);
        for (String entityType : plan.effectiveBackpatchOrder()) {
            backpatch.backpatch(entityType);
        }

        int purged = 0;
        if (settings.isPurgeDummies()) {
            purged = dummies.purgeExcept(plan.effectiveKeptDummyType()).deleted();
        }

        var summary = MigrationSummary.from(statistics, plan.migratedEntityTypes(), purged,
            Duration.between(started, Instant.now()));
        log.info("Migration finished{}{}", System.lineSeparator(), summary.toTable());
        summary.failures().forEach(f -> log.warn("  {} {} [{}]: {}", f.entityType(), f.sourceId(), f.phase(), f.message()));
        return summary;
    }

    private void refuseSameStore() {
        Optional<String> sourceEndpoint = source.endpoint();
        Optional<String> targetEndpoint = target.endpoint();
        if (sourceEndpoint.isPresent() && sourceEndpoint.equals(targetEndpoint)) {
            throw new FatalSetupException("Source and target are the same store (" + sourceEndpoint.get()
                + "), refusing to migrate a store onto itself");
        }
    }

    /** Delete target records of every migrated type, children before roots. */
    private void deleteExisting() {
        List<String> types = new ArrayList<>(plan.migratedEntityTypes());
        Collections.reverse(types);
        for (String entityType : types) {
            List<String> ids = target.queryIds(RecordQuery.all(entityType)).collectList().block(settings.getFlushTimeout());
            if (ids == null || ids.isEmpty()) {
                continue;
            }
            log.info("Deleting {} existing {} records from the target", ids.size(), entityType);
            int failed = 0;
            for (String id : ids) {
                try {
                    target.deleteRecord(entityType, id).block(settings.getFlushTimeout());
                } catch (RuntimeException e) {
                    failed++;
                    log.atWarn().setMessage("Could not delete {} {}: {}")
                        .addArgument(entityType).addArgument(id).addArgument(e.getMessage()).log();
                }
            }
            if (failed > 0) {
                log.warn("{} of {} existing {} records could not be deleted", failed, ids.size(), entityType);
            }
        }
    }

    private void prepareSnapshots(IdentityMap identityMap) {
        try {
            if (settings.isResume()) {
                int seeded = 0;
                for (String entityType : plan.migratedEntityTypes()) {
                    seeded += identityMap.seed(snapshots.readSnapshots(entityType));
                }
                log.info("Resuming: {} mappings restored from snapshots", seeded);
            } else {
                snapshots.clearSnapshots();
            }
        } catch (IOException e) {
            throw new SnapshotStoreException("Could not prepare the snapshot log", e);
        }
    }

    /**
     * One wide read gets the roots and every root-type record referencing one of them.
     * Roots are materialized first, then the discovered records.
     */
    private void materializeRoots(GraphMaterializer materializer, EntityMetadata metadata) {
        String rootType = plan.getRootEntityType();
        List<String> rootIds = plan.getRootIds();
        if (rootIds.isEmpty()) {
            log.warn("No {} roots to migrate", rootType);
            return;
        }
        RecordQuery query = RecordQuery.byIds(rootType, rootIds);
        for (String field : discoveryFields(metadata)) {
            query = query.or(field, rootIds);
        }
        List<SourceRecord> fetched = source.queryRecords(query.withLimit(plan.getPrefetchLimit()))
            .collectList()
            .block(settings.getFlushTimeout());
        fetched = fetched != null ? fetched : List.of();
        log.info("Fetched {} {} records for {} root(s)", fetched.size(), rootType, rootIds.size());
        materializer.prefetch(fetched);

        Set<String> roots = new LinkedHashSet<>(rootIds);
        for (String rootId : roots) {
            materializer.materialize(rootType, rootId);
        }
        for (SourceRecord record : fetched) {
            if (!roots.contains(record.id())) {
                materializer.materialize(record);
            }
        }
        materializer.flushAll();
    }

    private List<String> discoveryFields(EntityMetadata metadata) {
        if (!plan.getDiscoveryFields().isEmpty()) {
            return plan.getDiscoveryFields();
        }
        var fields = new ArrayList<String>();
        metadata.describe(plan.getRootEntityType()).selfReferenceFields().forEach(f -> fields.add(f.name()));
        return fields;
    }

    private void materializeChildren(GraphMaterializer materializer, IdentityMap identityMap, ChildSpec child) {
        List<String> parentIds = new ArrayList<>(identityMap.sourceIds(child.parentEntityType()));
        if (parentIds.isEmpty()) {
            log.info("No migrated {} parents, skipping {}", child.parentEntityType(), child.entityType());
            return;
        }
        Flux<SourceRecord> children = child.isLimited()
            ? Flux.fromIterable(parentIds).concatMap(parentId -> source.queryRecords(
                RecordQuery.whereEquals(child.entityType(), child.parentField(), parentId).withLimit(child.limit())))
            : Flux.fromIterable(parentIds).buffer(PARENT_IDS_PER_QUERY).concatMap(chunk -> source.queryRecords(
                RecordQuery.where(child.entityType(), child.parentField(), chunk)));
        List<SourceRecord> records = children.collectList().block(settings.getFlushTimeout());
        records = records != null ? records : List.of();
        log.info("Found {} {} records under {} {} parent(s)",
            records.size(), child.entityType(), parentIds.size(), child.parentEntityType());
        materializer.prefetch(records);
        for (SourceRecord record : records) {
            materializer.materialize(record);
        }
        materializer.flushAll();
    }
}
