package org.sandcastle.migrations.graph.batch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.sandcastle.migrations.graph.store.BulkOperationException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Collects entries per entity type and submits them in bulk, either when a type reaches the
 * batch size or on demand.
 *
 * The i-th id of a flush belongs to the i-th entry added since the previous flush; a response
 * that cannot honour that is a failed flush. A failed flush leaves the queue untouched so the
 * caller can retry it, or {@link #clear(String)} it before falling back to single submissions.
 *
 * Each type's queue is guarded separately, so flushing one type does not hold up another.
 *
 * @param <T> what is queued, typically a payload together with what it was built from
 */
@Slf4j
public class BatchAccumulator<T> {

    /** Submits one batch; emits one id per entry, in entry order. */
    @FunctionalInterface
    public interface BulkSubmitter<T> {
        Mono<List<String>> submit(String entityType, List<T> batch);
    }

    public record FlushOutcome<T>(String entityType, List<T> entries, List<String> targetIds) {
        public FlushOutcome {
            entries = List.copyOf(entries);
            targetIds = List.copyOf(targetIds);
        }

        public int size() {
            return entries.size();
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }
    }

    private final int batchSize;
    private final Duration flushTimeout;
    private final BulkSubmitter<T> submitter;
    private final Function<T, String> keyOf;
    private final Map<String, List<T>> pending = new ConcurrentHashMap<>();

    /**
     * @param keyOf identifies an entry within its type, for {@link #isPending(String, String)}
     */
    public BatchAccumulator(int batchSize, Duration flushTimeout, BulkSubmitter<T> submitter, Function<T, String> keyOf) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1, was " + batchSize);
        }
        this.batchSize = batchSize;
        this.flushTimeout = flushTimeout;
        this.submitter = submitter;
        this.keyOf = keyOf;
    }

    /**
     * Queue an entry, flushing its type when the batch is full.
     *
     * @return the outcome when this call triggered a flush
     * @throws BatchFlushException if the triggered flush failed; the entry stays queued
     */
    public Optional<FlushOutcome<T>> add(String entityType, T entry) {
        List<T> queue = queueOf(entityType);
        synchronized (queue) {
            queue.add(entry);
            if (queue.size() < batchSize) {
                return Optional.empty();
            }
            log.atDebug().setMessage("{} batch is full ({}), flushing").addArgument(entityType).addArgument(queue.size()).log();
            return Optional.of(flushQueue(entityType, queue));
        }
    }

    /**
     * Submit everything pending for the type.
     *
     * @throws BatchFlushException if the submission failed, timed out or returned the wrong number of ids
     */
    public FlushOutcome<T> flush(String entityType) {
        List<T> queue = queueOf(entityType);
        synchronized (queue) {
            return flushQueue(entityType, queue);
        }
    }

    /** Drop and return everything pending for the type, in the order it was added. */
    public List<T> clear(String entityType) {
        List<T> queue = queueOf(entityType);
        synchronized (queue) {
            var drained = new ArrayList<>(queue);
            queue.clear();
            return drained;
        }
    }

    public int pendingCount(String entityType) {
        List<T> queue = queueOf(entityType);
        synchronized (queue) {
            return queue.size();
        }
    }

    public boolean isPending(String entityType, String key) {
        List<T> queue = pending.get(entityType);
        if (queue == null || key == null) {
            return false;
        }
        synchronized (queue) {
            return queue.stream().anyMatch(entry -> key.equals(keyOf.apply(entry)));
        }
    }

    /** Types with at least one entry waiting, in no particular order. */
    public Set<String> pendingTypes() {
        var types = new LinkedHashSet<String>();
        pending.forEach((type, queue) -> {
            synchronized (queue) {
                if (!queue.isEmpty()) {
                    types.add(type);
                }
            }
        });
        return types;
    }

    public int getBatchSize() {
        return batchSize;
    }

    private List<T> queueOf(String entityType) {
        return pending.computeIfAbsent(entityType, t -> new ArrayList<>());
    }

    private FlushOutcome<T> flushQueue(String entityType, List<T> queue) {
        if (queue.isEmpty()) {
            return new FlushOutcome<>(entityType, List.of(), List.of());
        }
        List<T> batch = List.copyOf(queue);
        List<String> ids;
        try {
            ids = submitter.submit(entityType, batch).block(flushTimeout);
        } catch (BulkOperationException e) {
            throw new BatchFlushException(entityType, batch.size(), e.getPartialResults(),
                "Bulk submission of " + batch.size() + " " + entityType + " entries failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new BatchFlushException(entityType, batch.size(), List.of(),
                "Bulk submission of " + batch.size() + " " + entityType + " entries failed: " + e.getMessage(), e);
        }
        if (ids == null || ids.size() != batch.size() || ids.stream().anyMatch(Objects::isNull)) {
            throw new BatchFlushException(entityType, batch.size(), ids,
                "Bulk submission of " + batch.size() + " " + entityType + " entries returned "
                    + (ids == null ? "no" : String.valueOf(ids.stream().filter(Objects::nonNull).count())) + " ids",
                null);
        }
        queue.clear();
        log.atDebug().setMessage("Flushed {} {} entries").addArgument(batch.size()).addArgument(entityType).log();
        return new FlushOutcome<>(entityType, batch, ids);
    }
}
