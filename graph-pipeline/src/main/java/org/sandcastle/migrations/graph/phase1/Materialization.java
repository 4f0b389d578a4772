package org.sandcastle.migrations.graph.phase1;

import java.util.Optional;

import org.sandcastle.migrations.graph.phase1.MaterializationTracker.State;

/**
 * What a call to materialize a record achieved. Only a mapped record has a target id;
 * a submitted one gets its id when its batch is flushed.
 */
public record Materialization(State state, String targetId) {

    public static Materialization mapped(String targetId) {
        return new Materialization(State.MAPPED, targetId);
    }

    public static Materialization notCreated(State state) {
        return new Materialization(state, null);
    }

    public boolean isMapped() {
        return state == State.MAPPED;
    }

    public Optional<String> target() {
        return Optional.ofNullable(targetId);
    }
}
