package org.sandcastle.migrations.graph.phase1;

import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
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
import org.sandcastle.migrations.graph.ir.SourceRecord;
import org.sandcastle.migrations.graph.phase1.MaterializationTracker.State;
import org.sandcastle.migrations.graph.rewrite.ReferenceRewriter;
import org.sandcastle.migrations.graph.rewrite.RewrittenRecord;
import org.sandcastle.migrations.graph.snapshot.SnapshotStoreException;
import org.sandcastle.migrations.graph.store.DuplicateRecordException;

import lombok.extern.slf4j.Slf4j;

/**
 * Phase 1: creates source records in the target with every required reference satisfied.
 *
 * Same-type dependencies of a record are materialized before the record itself, so that it can
 * point at their real target ids. A dependency already on the recursion path is not entered
 * again; the record gets the placeholder (or nothing) for it and Phase 2 corrects the field.
 *
 * Every created or adopted record is added to the identity map and gets a snapshot. A record
 * that cannot be created is logged as failed and is not retried in the same run; records that
 * require it fall back to the placeholder.
 *
 * One materializer serves one thread of control.
 */
@Slf4j
public class GraphMaterializer {

    private record PendingCreate(SourceRecord record, RewrittenRecord rewritten) {}

    private final MigrationContext context;
    private final ReferenceRewriter rewriter;
    private final MaterializationTracker tracker = new MaterializationTracker();
    private final BatchAccumulator<PendingCreate> accumulator;
    private final Map<String, Map<String, SourceRecord>> prefetched = new HashMap<>();
    private final Duration timeout;

    public GraphMaterializer(MigrationContext context) {
        this.context = context;
        this.rewriter = context.newRewriter();
        this.timeout = context.getSettings().getFlushTimeout();
        this.accumulator = new BatchAccumulator<>(
            context.getSettings().getBatchSize(),
            timeout,
            (entityType, batch) -> context.getTarget().bulkCreate(entityType,
                batch.stream().map(p -> p.rewritten().payload()).collect(Collectors.toList())),
            p -> p.record().id());
    }

    /** Hand over records already read in bulk so dependency resolution does not fetch them again. */
    public void prefetch(Collection<SourceRecord> records) {
        for (SourceRecord record : records) {
            prefetched.computeIfAbsent(record.entityType(), t -> new HashMap<>()).putIfAbsent(record.id(), record);
        }
    }

    public Materialization materialize(String entityType, String sourceId) {
        return materialize(entityType, sourceId, null);
    }

    public Materialization materialize(SourceRecord record) {
        return materialize(record.entityType(), record.id(), record);
    }

    /** Submit every queued creation. Each record involved ends up mapped or failed. */
    public void flushAll() {
        for (String entityType : accumulator.pendingTypes()) {
            flush(entityType);
        }
    }

    public void flush(String entityType) {
        try {
            onFlushed(accumulator.flush(entityType));
        } catch (BatchFlushException e) {
            recoverFailedFlush(entityType, e);
        }
    }

    public State stateOf(String entityType, String sourceId) {
        if (context.getIdentityMap().contains(entityType, sourceId)) {
            return State.MAPPED;
        }
        return tracker.stateOf(entityType, sourceId);
    }

    public int pendingCount(String entityType) {
        return accumulator.pendingCount(entityType);
    }

    private Materialization materialize(String entityType, String sourceId, SourceRecord given) {
        Optional<String> mapped = context.getIdentityMap().lookup(entityType, sourceId);
        if (mapped.isPresent()) {
            return Materialization.mapped(mapped.get());
        }
        State state = tracker.stateOf(entityType, sourceId);
        if (state != State.UNVISITED) {
            return Materialization.notCreated(state);
        }
        tracker.mark(entityType, sourceId, State.RESOLVING);

        SourceRecord record = given != null ? given : fetch(entityType, sourceId);
        if (record == null) {
            return Materialization.notCreated(State.FAILED);
        }
        if (context.getSettings().isResolveSameTypeDependencies()) {
            resolveSameTypeDependencies(record);
        }
        flushPendingReferences(record);

        RewrittenRecord rewritten = rewriter.rewrite(record);
        var pendingCreate = new PendingCreate(record, rewritten);
        if (!context.getSettings().isBatchedCreation()) {
            createSingle(pendingCreate);
            return current(entityType, sourceId);
        }

        tracker.mark(entityType, sourceId, State.SUBMITTED);
        try {
            accumulator.add(entityType, pendingCreate).ifPresent(this::onFlushed);
        } catch (BatchFlushException e) {
            recoverFailedFlush(entityType, e);
        }
        return current(entityType, sourceId);
    }

    private SourceRecord fetch(String entityType, String sourceId) {
        var byId = prefetched.get(entityType);
        if (byId != null && byId.containsKey(sourceId)) {
            return byId.remove(sourceId);
        }
        try {
            SourceRecord record = context.getSource().fetchRecord(entityType, sourceId).block(timeout);
            if (record == null) {
                fail(entityType, sourceId, "not found in source", null);
            }
            return record;
        } catch (RuntimeException e) {
            fail(entityType, sourceId, "could not be read from source: " + e.getMessage(), e);
            return null;
        }
    }

    private void resolveSameTypeDependencies(SourceRecord record) {
        EntityType type = context.getMetadata().describe(record.entityType());
        for (FieldSpec field : type.selfReferenceFields()) {
            String dependencyId = record.reference(field.name());
            if (dependencyId == null || dependencyId.equals(record.id())) {
                continue;
            }
            State dependencyState = stateOf(record.entityType(), dependencyId);
            if (dependencyState == State.UNVISITED) {
                log.atDebug().setMessage("{} {} depends on {} via {}, materializing it first")
                    .addArgument(record.entityType()).addArgument(record.id())
                    .addArgument(dependencyId).addArgument(field.name()).log();
                materialize(record.entityType(), dependencyId, null);
            } else if (dependencyState == State.RESOLVING) {
                log.atDebug().setMessage("{} {} -> {} closes a cycle, leaving {} to Phase 2")
                    .addArgument(record.entityType()).addArgument(record.id())
                    .addArgument(dependencyId).addArgument(field.name()).log();
            }
        }
    }

    /** Referenced records still waiting in a batch get their ids now, so this record can use them. */
    private void flushPendingReferences(SourceRecord record) {
        EntityType type = context.getMetadata().describe(record.entityType());
        for (FieldSpec field : type.referenceFields()) {
            String ref = record.reference(field.name());
            if (ref != null && !ref.equals(record.id()) && accumulator.isPending(field.referencedType(), ref)) {
                flush(field.referencedType());
            }
        }
    }

    private void onFlushed(FlushOutcome<PendingCreate> outcome) {
        for (int i = 0; i < outcome.size(); i++) {
            var pendingCreate = outcome.entries().get(i);
            recordMapped(pendingCreate.record(), outcome.targetIds().get(i), pendingCreate.rewritten().writtenReferences(),
                Counter.CREATED);
        }
        if (!outcome.isEmpty()) {
            log.info("Created {} {} records in bulk", outcome.size(), outcome.entityType());
        }
    }

    /**
     * Retry the flush as configured, then keep what the last attempt reports as written and
     * create the rest one at a time from the same payloads.
     */
    private void recoverFailedFlush(String entityType, BatchFlushException firstFailure) {
        BatchFlushException failure = firstFailure;
        for (int attempt = 2; attempt <= context.getSettings().getFlushAttempts(); attempt++) {
            log.atWarn().setMessage("{}; attempt {} of {}")
                .addArgument(failure.getMessage()).addArgument(attempt).addArgument(context.getSettings().getFlushAttempts()).log();
            try {
                onFlushed(accumulator.flush(entityType));
                return;
            } catch (BatchFlushException e) {
                failure = e;
            }
        }
        List<PendingCreate> entries = accumulator.clear(entityType);
        List<String> partialIds = failure.getPartialIds();
        log.atWarn().setMessage("{}; creating {} {} records one by one")
            .addArgument(failure.getMessage()).addArgument(entries.size()).addArgument(entityType).setCause(failure.getCause()).log();
        for (int i = 0; i < entries.size(); i++) {
            var pendingCreate = entries.get(i);
            String partialId = partialIds.isEmpty() ? null : partialIds.get(i);
            if (partialId != null) {
                recordMapped(pendingCreate.record(), partialId, pendingCreate.rewritten().writtenReferences(), Counter.CREATED);
            } else {
                createSingle(pendingCreate);
            }
        }
    }

    /** Store failures fail the record; snapshot failures propagate like they do for bulk creates. */
    private void createSingle(PendingCreate pendingCreate) {
        SourceRecord record = pendingCreate.record();
        String targetId;
        try {
            targetId = context.getTarget().createRecord(record.entityType(), pendingCreate.rewritten().payload())
                .block(timeout);
        } catch (DuplicateRecordException e) {
            var existingId = e.getExistingId();
            if (existingId.isEmpty()) {
                fail(record.entityType(), record.id(), e.getMessage(), e);
                return;
            }
            log.info("{} {} already exists in the target as {}, adopting it",
                record.entityType(), record.id(), existingId.get());
            // The adopted record was not written from this payload, so Phase 2 owes it every reference.
            recordMapped(record, existingId.get(), Map.of(), Counter.ADOPTED);
            return;
        } catch (RuntimeException e) {
            fail(record.entityType(), record.id(), e.getMessage(), e);
            return;
        }
        if (targetId == null) {
            fail(record.entityType(), record.id(), "target returned no id", null);
            return;
        }
        recordMapped(record, targetId, pendingCreate.rewritten().writtenReferences(), Counter.CREATED);
        log.atDebug().setMessage("Created {} {} as {}")
            .addArgument(record.entityType()).addArgument(record.id()).addArgument(targetId).log();
    }

    private void recordMapped(SourceRecord record, String targetId, Map<String, String> writtenReferences, Counter counter) {
        String mappedId = context.getIdentityMap().putIfAbsent(record.entityType(), record.id(), targetId);
        tracker.mark(record.entityType(), record.id(), State.MAPPED);
        try {
            context.getSnapshots().appendSnapshot(
                new Snapshot(record.entityType(), record.id(), mappedId, record, writtenReferences));
        } catch (IOException e) {
            throw new SnapshotStoreException("Could not write snapshot of " + record.entityType() + " " + record.id(), e);
        }
        context.getStatistics().increment(record.entityType(), counter);
    }

    private void fail(String entityType, String sourceId, String message, Throwable cause) {
        tracker.mark(entityType, sourceId, State.FAILED);
        context.getStatistics().recordFailure(new RecordFailure(entityType, sourceId, RecordFailure.Phase.MATERIALIZE, message));
        context.getStatistics().increment(entityType, Counter.FAILED);
        log.atError().setMessage("Failed to create {} {}: {}")
            .addArgument(entityType).addArgument(sourceId).addArgument(message).setCause(cause).log();
    }

    private Materialization current(String entityType, String sourceId) {
        return context.getIdentityMap().lookup(entityType, sourceId)
            .map(Materialization::mapped)
            .orElseGet(() -> Materialization.notCreated(tracker.stateOf(entityType, sourceId)));
    }
}
