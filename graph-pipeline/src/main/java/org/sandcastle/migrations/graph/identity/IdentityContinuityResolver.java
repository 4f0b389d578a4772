package org.sandcastle.migrations.graph.identity;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.sandcastle.migrations.graph.store.RecordQuery;
import org.sandcastle.migrations.graph.store.RecordTarget;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

/**
 * References to entity types shared by source and target (principals such as users) are
 * carried over by identity instead of by migration: a source id that exists in the target is
 * kept as-is, otherwise a configured or discovered fallback identity stands in for it.
 *
 * Existence checks and fallbacks are cached for the lifetime of the resolver, which is one run.
 */
@Slf4j
public class IdentityContinuityResolver {

    /**
     * @param fallbackId fixed target id to substitute, may be null
     * @param fallbackQuery query whose first match becomes the fallback when no fixed id is set, may be null
     */
    public record Policy(String entityType, String fallbackId, RecordQuery fallbackQuery) {
        public static Policy keepExisting(String entityType) {
            return new Policy(entityType, null, null);
        }
    }

    private final RecordTarget target;
    private final Map<String, Policy> policies;
    private final Duration timeout;
    private final Cache<String, Boolean> existence = Caffeine.newBuilder().maximumSize(100_000).build();
    private final Map<String, Optional<String>> fallbacks = new ConcurrentHashMap<>();

    public IdentityContinuityResolver(RecordTarget target, Collection<Policy> policies, Duration timeout) {
        this.target = target;
        var byType = new LinkedHashMap<String, Policy>();
        policies.forEach(p -> byType.put(p.entityType(), p));
        this.policies = Map.copyOf(byType);
        this.timeout = timeout;
    }

    public static IdentityContinuityResolver none() {
        return new IdentityContinuityResolver(null, Set.of(), Duration.ofSeconds(30));
    }

    public boolean handles(String entityType) {
        return policies.containsKey(entityType);
    }

    public Set<String> entityTypes() {
        return policies.keySet();
    }

    /**
     * The target id to write for a source reference to a continuity type: the same id when the
     * target has it, else the fallback, else empty (the reference is dropped).
     */
    public Optional<String> resolve(String entityType, String sourceRef) {
        if (sourceRef == null) {
            return Optional.empty();
        }
        if (existsInTarget(entityType, sourceRef)) {
            return Optional.of(sourceRef);
        }
        Optional<String> fallback = fallbackIdentity(entityType);
        log.atDebug().setMessage("{} {} is not in the target, using fallback {}")
            .addArgument(entityType).addArgument(sourceRef).addArgument(fallback).log();
        return fallback;
    }

    /** The stand-in identity of a type, discovered at most once. */
    public Optional<String> fallbackIdentity(String entityType) {
        return fallbacks.computeIfAbsent(entityType, this::discoverFallback);
    }

    boolean existsInTarget(String entityType, String id) {
        return existence.get(entityType + "|" + id, key -> {
            try {
                return Boolean.TRUE.equals(target.exists(entityType, id).block(timeout));
            } catch (RuntimeException e) {
                log.atWarn().setMessage("Could not check whether {} {} exists in the target")
                    .addArgument(entityType).addArgument(id).setCause(e).log();
                return false;
            }
        });
    }

    private Optional<String> discoverFallback(String entityType) {
        Policy policy = policies.get(entityType);
        if (policy == null) {
            return Optional.empty();
        }
        if (policy.fallbackId() != null) {
            return Optional.of(policy.fallbackId());
        }
        if (policy.fallbackQuery() == null) {
            return Optional.empty();
        }
        try {
            Optional<String> found = Optional.ofNullable(target.queryIds(policy.fallbackQuery().withLimit(1)).next().block(timeout));
            if (found.isPresent()) {
                log.info("Using {} {} as fallback identity", entityType, found.get());
            } else {
                log.warn("No fallback identity found for {}; unmatched references will be dropped", entityType);
            }
            return found;
        } catch (RuntimeException e) {
            log.atWarn().setMessage("Fallback discovery for {} failed").addArgument(entityType).setCause(e).log();
            return Optional.empty();
        }
    }
}
