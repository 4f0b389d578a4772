package org.sandcastle.migrations.graph;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per entity type outcome counters and the failures behind them. Safe for concurrent use.
 */
public class RunStatistics {

    public enum Counter {
        CREATED,
        ADOPTED,
        FAILED,
        UPDATED,
        SKIPPED,
        ERRORED
    }

    private final Map<String, EnumMap<Counter, Integer>> counters = new LinkedHashMap<>();
    private final List<RecordFailure> failures = new ArrayList<>();

    public void increment(String entityType, Counter counter) {
        add(entityType, counter, 1);
    }

    public synchronized void add(String entityType, Counter counter, int amount) {
        counters.computeIfAbsent(entityType, t -> new EnumMap<>(Counter.class)).merge(counter, amount, Integer::sum);
    }

    public synchronized int get(String entityType, Counter counter) {
        var byCounter = counters.get(entityType);
        return byCounter == null ? 0 : byCounter.getOrDefault(counter, 0);
    }

    public synchronized void recordFailure(RecordFailure failure) {
        failures.add(failure);
    }

    public synchronized List<RecordFailure> getFailures() {
        return List.copyOf(failures);
    }

    public synchronized List<RecordFailure> failuresOf(String entityType) {
        return failures.stream().filter(f -> f.entityType().equals(entityType)).collect(Collectors.toList());
    }

    public synchronized boolean hasFailure(String entityType, String sourceId) {
        return failures.stream().anyMatch(f -> f.entityType().equals(entityType) && Objects.equals(f.sourceId(), sourceId));
    }

    /** Types with at least one counted outcome, in the order they were first counted. */
    public synchronized Set<String> entityTypes() {
        return new LinkedHashSet<>(counters.keySet());
    }
}
