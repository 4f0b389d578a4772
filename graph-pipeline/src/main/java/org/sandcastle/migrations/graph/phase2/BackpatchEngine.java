package org.sandcastle.migrations.graph.phase2;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.sandcastle.migrations.graph.MigrationContext;
import org.sandcastle.migrations.graph.RecordFailure;
import org.sandcastle.migrations.graph.RunStatistics.Counter;
import org.sandcastle.migrations.graph.batch.BatchAccumulator;
import org.sandcastle.migrations.graph.batch.BatchAccumulator.FlushOutcome;
import org.sandcastle.migrations.graph.batch.BatchFlushException;
import org.sandcastle.migrations.graph.ir.EntityType;
import org.sandcastle.migrations.graph.ir.FieldSpec;
import org.sandcastle.migrations.graph.ir.Snapshot;
import org.sandcastle.migrations.graph.ir.UpdatePayload;
import org.sandcastle.migrations.graph.snapshot.SnapshotStoreException;

import lombok.extern.slf4j.Slf4j;

/**
 * Phase 2: once every record has a target id, rewrites the references that Phase 1 had to
 * point at a placeholder or leave out.
 *
 * A field is only patched when it can be updated after creation, is not carried over by
 * identity continuity, resolves to something other than the placeholder, and differs from what
 * Phase 1 wrote. Updates go out in bulk; a failed batch falls back to one update per record,
 * and a failed record to one update per field.
 */
@Slf4j
public class BackpatchEngine {

    public record BackpatchResult(String entityType, int updated, int skipped, int errored) {
        @Override
        public String toString() {
            return entityType + ": " + updated + " updated, " + skipped + " skipped, " + errored + " errors";
        }
    }

    private final MigrationContext context;
    private final Duration timeout;

    public BackpatchEngine(MigrationContext context) {
        this.context = context;
        this.timeout = context.getSettings().getFlushTimeout();
    }

    public BackpatchResult backpatch(String entityType) {
        List<Snapshot> snapshots;
        try {
            snapshots = context.getSnapshots().readSnapshots(entityType);
        } catch (IOException e) {
            throw new SnapshotStoreException("Could not read " + entityType + " snapshots", e);
        }
        EntityType type = context.getMetadata().describe(entityType);
        var counts = new Tally(entityType, snapshots);
        var accumulator = new BatchAccumulator<UpdatePayload>(
            context.getSettings().getBatchSize(),
            timeout,
            (t, batch) -> context.getTarget().bulkUpdate(t, batch)
                .thenReturn(batch.stream().map(UpdatePayload::targetId).collect(Collectors.toList())),
            UpdatePayload::targetId);

        log.info("Backpatching {} {} records", snapshots.size(), entityType);
        for (Snapshot snapshot : snapshots) {
            Optional<UpdatePayload> update = buildUpdate(type, snapshot);
            if (update.isEmpty()) {
                counts.skipped++;
                continue;
            }
            try {
                accumulator.add(entityType, update.get()).ifPresent(counts::flushed);
            } catch (BatchFlushException e) {
                recoverFailedFlush(type, accumulator, e, counts);
            }
        }
        try {
            counts.flushed(accumulator.flush(entityType));
        } catch (BatchFlushException e) {
            recoverFailedFlush(type, accumulator, e, counts);
        }

        var result = new BackpatchResult(entityType, counts.updated, counts.skipped, counts.errored);
        context.getStatistics().add(entityType, Counter.UPDATED, result.updated());
        context.getStatistics().add(entityType, Counter.SKIPPED, result.skipped());
        context.getStatistics().add(entityType, Counter.ERRORED, result.errored());
        log.info("Phase 2 {}", result);
        return result;
    }

    /**
     * The reference corrections one snapshot still needs, or empty when it needs none.
     */
    public Optional<UpdatePayload> buildUpdate(EntityType type, Snapshot snapshot) {
        var fields = new LinkedHashMap<String, Object>();
        for (FieldSpec field : type.referenceFields()) {
            String referencedType = field.referencedType();
            if (field.immutableAfterCreate() || context.getContinuity().handles(referencedType)) {
                continue;
            }
            String sourceRef = snapshot.record().reference(field.name());
            if (sourceRef == null) {
                continue;
            }
            Optional<String> resolved = context.getStableNames().handles(referencedType)
                ? context.getStableNames().resolve(type.name(), sourceRef)
                : context.getIdentityMap().lookup(referencedType, sourceRef);
            if (resolved.isEmpty()) {
                log.atDebug().setMessage("{} {}: {} -> {} {} is not migrated, leaving it")
                    .addArgument(type.name()).addArgument(snapshot.sourceId()).addArgument(field.name())
                    .addArgument(referencedType).addArgument(sourceRef).log();
                continue;
            }
            String targetRef = resolved.get();
            if (context.getDummies().isDummy(referencedType, targetRef)
                || targetRef.equals(snapshot.writtenReferences().get(field.name()))) {
                continue;
            }
            fields.put(field.name(), targetRef);
        }
        return fields.isEmpty() ? Optional.empty() : Optional.of(new UpdatePayload(snapshot.targetId(), fields));
    }

    private void recoverFailedFlush(EntityType type,
                                    BatchAccumulator<UpdatePayload> accumulator,
                                    BatchFlushException firstFailure,
                                    Tally counts) {
        BatchFlushException failure = firstFailure;
        for (int attempt = 2; attempt <= context.getSettings().getFlushAttempts(); attempt++) {
            log.atWarn().setMessage("{}; attempt {} of {}")
                .addArgument(failure.getMessage()).addArgument(attempt).addArgument(context.getSettings().getFlushAttempts()).log();
            try {
                counts.flushed(accumulator.flush(type.name()));
                return;
            } catch (BatchFlushException e) {
                failure = e;
            }
        }
        applyIndividually(type, accumulator.clear(type.name()), failure, counts);
    }

    private void applyIndividually(EntityType type, List<UpdatePayload> updates, BatchFlushException failure, Tally counts) {
        log.atWarn().setMessage("{}; updating {} {} records one by one")
            .addArgument(failure.getMessage()).addArgument(updates.size()).addArgument(type.name())
            .setCause(failure.getCause()).log();
        List<String> landed = failure.getPartialIds();
        for (int i = 0; i < updates.size(); i++) {
            UpdatePayload update = updates.get(i);
            // positional over the failed batch; a non-null slot was already applied
            if (i < landed.size() && landed.get(i) != null) {
                counts.updated++;
                continue;
            }
            try {
                context.getTarget().updateRecord(type.name(), update.targetId(), update.fields()).block(timeout);
                counts.updated++;
            } catch (RuntimeException e) {
                counts.errored++;
                log.atWarn().setMessage("Update of {} {} failed: {}")
                    .addArgument(type.name()).addArgument(update.targetId()).addArgument(e.getMessage()).log();
                if (update.fields().size() > 1) {
                    applyFieldByField(type, update, counts);
                } else {
                    recordFailure(type, update, e.getMessage(), counts);
                }
            }
        }
    }

    private void applyFieldByField(EntityType type, UpdatePayload update, Tally counts) {
        int applied = 0;
        for (Map.Entry<String, Object> field : update.fields().entrySet()) {
            try {
                context.getTarget().updateRecord(type.name(), update.targetId(), Map.of(field.getKey(), field.getValue()))
                    .block(timeout);
                applied++;
            } catch (RuntimeException e) {
                recordFailure(type, update, field.getKey() + ": " + e.getMessage(), counts);
            }
        }
        log.info("{} {}: {} of {} fields updated individually", type.name(), update.targetId(), applied, update.fields().size());
    }

    private void recordFailure(EntityType type, UpdatePayload update, String message, Tally counts) {
        String sourceId = counts.sourceIdsByTarget.getOrDefault(update.targetId(), update.targetId());
        context.getStatistics().recordFailure(
            new RecordFailure(type.name(), sourceId, RecordFailure.Phase.BACKPATCH, message));
        log.atError().setMessage("Could not backpatch {} {}: {}")
            .addArgument(type.name()).addArgument(update.targetId()).addArgument(message).log();
    }

    private static class Tally {
        private final String entityType;
        private final Map<String, String> sourceIdsByTarget = new HashMap<>();
        private int updated;
        private int skipped;
        private int errored;

        Tally(String entityType, List<Snapshot> snapshots) {
            this.entityType = entityType;
            for (Snapshot snapshot : snapshots) {
                sourceIdsByTarget.putIfAbsent(snapshot.targetId(), snapshot.sourceId());
            }
        }

        void flushed(FlushOutcome<UpdatePayload> outcome) {
            updated += outcome.size();
            if (!outcome.isEmpty()) {
                log.info("Updated {} {} records in bulk", outcome.size(), entityType);
            }
        }
    }
}
