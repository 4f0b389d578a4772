package org.sandcastle.migrations.store;

import org.sandcastle.migrations.graph.store.StableNameResolver;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Record types exist independently in both stores with different ids; they are matched by
 * developer name within the owning entity type.
 */
@Slf4j
@RequiredArgsConstructor
public class RecordTypeNameResolver implements StableNameResolver {
    private final RestRecordStore source;
    private final RestRecordStore target;

    @Override
    public Mono<String> resolveStableName(String ownerEntityType, String sourceRef) {
        return source.recordTypeDeveloperName(sourceRef)
            .doOnNext(name -> log.debug("Source record type {} is {}.{}", sourceRef, ownerEntityType, name))
            .flatMap(name -> target.recordTypeId(ownerEntityType, name));
    }
}
