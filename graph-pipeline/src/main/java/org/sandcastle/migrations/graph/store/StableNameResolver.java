package org.sandcastle.migrations.graph.store;

import reactor.core.publisher.Mono;

/**
 * Maps a source reference to a category/subtype record onto the target record that carries
 * the same stable name (for example a developer name), instead of onto a migrated copy.
 */
@FunctionalInterface
public interface StableNameResolver {

    /**
     * @param ownerEntityType the entity type whose field holds the reference
     * @param sourceRef the raw source id held by that field
     * @return the equivalent target id, or empty when the target has no such name
     */
    Mono<String> resolveStableName(String ownerEntityType, String sourceRef);

    StableNameResolver NONE = (ownerEntityType, sourceRef) -> Mono.empty();
}
