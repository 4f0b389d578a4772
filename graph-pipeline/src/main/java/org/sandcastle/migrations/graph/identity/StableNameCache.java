package org.sandcastle.migrations.graph.identity;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import org.sandcastle.migrations.graph.store.StableNameResolver;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

/**
 * Run-scoped cache in front of a {@link StableNameResolver}. Misses are cached too, so each
 * unresolvable name is looked up and reported once.
 */
@Slf4j
public class StableNameCache {

    private record Key(String ownerEntityType, String sourceRef) {}

    private final StableNameResolver resolver;
    private final Set<String> stableNameTypes;
    private final Duration timeout;
    private final Cache<Key, Optional<String>> resolved = Caffeine.newBuilder().maximumSize(10_000).build();

    public StableNameCache(StableNameResolver resolver, Set<String> stableNameTypes, Duration timeout) {
        this.resolver = resolver;
        this.stableNameTypes = Set.copyOf(stableNameTypes);
        this.timeout = timeout;
    }

    public static StableNameCache none() {
        return new StableNameCache(StableNameResolver.NONE, Set.of(), Duration.ofSeconds(30));
    }

    /** Whether references to this entity type are matched by stable name. */
    public boolean handles(String referencedType) {
        return stableNameTypes.contains(referencedType);
    }

    public Optional<String> resolve(String ownerEntityType, String sourceRef) {
        if (sourceRef == null) {
            return Optional.empty();
        }
        return resolved.get(new Key(ownerEntityType, sourceRef), this::lookup);
    }

    private Optional<String> lookup(Key key) {
        try {
            Optional<String> targetId = Optional.ofNullable(
                resolver.resolveStableName(key.ownerEntityType(), key.sourceRef()).block(timeout));
            if (targetId.isEmpty()) {
                log.warn("No target equivalent for {} reference {}", key.ownerEntityType(), key.sourceRef());
            }
            return targetId;
        } catch (RuntimeException e) {
            log.atWarn().setMessage("Stable name lookup for {} reference {} failed")
                .addArgument(key.ownerEntityType()).addArgument(key.sourceRef()).setCause(e).log();
            return Optional.empty();
        }
    }
}
