package org.sandcastle.migrations.graph.phase1;

import java.util.HashMap;
import java.util.Map;

/**
 * Where each record visited in Phase 1 stands. A record not tracked yet is unvisited.
 * Records in {@link State#RESOLVING} are on the current recursion path.
 */
public class MaterializationTracker {

    public enum State {
        UNVISITED,
        RESOLVING,
        SUBMITTED,
        MAPPED,
        FAILED;

        public boolean isInFlight() {
            return this == RESOLVING || this == SUBMITTED;
        }
    }

    private record Key(String entityType, String sourceId) {}

    private final Map<Key, State> states = new HashMap<>();

    public synchronized State stateOf(String entityType, String sourceId) {
        return states.getOrDefault(new Key(entityType, sourceId), State.UNVISITED);
    }

    public synchronized void mark(String entityType, String sourceId, State state) {
        states.put(new Key(entityType, sourceId), state);
    }

    public synchronized int count(State state) {
        return (int) states.values().stream().filter(s -> s == state).count();
    }
}
