package org.sandcastle.migrations.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.sandcastle.migrations.graph.MigrationSettings;
import org.sandcastle.migrations.graph.identity.DummyTemplate;
import org.sandcastle.migrations.graph.identity.IdentityContinuityResolver;
import org.sandcastle.migrations.graph.run.MigrationPlan;
import org.sandcastle.migrations.graph.run.MigrationPlan.ChildSpec;
import org.sandcastle.migrations.graph.store.RecordQuery;
import org.sandcastle.migrations.store.http.ConnectionContext;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON run configuration: where to read from and write to, what to copy, and how.
 *
 * <pre>
 * {
 *   "source": {"uri": "https://src.example.com", "accessTokenEnv": "SOURCE_TOKEN"},
 *   "target": {"uri": "https://tgt.example.com", "accessTokenEnv": "TARGET_TOKEN"},
 *   "snapshotDirectory": "migration_data",
 *   "plan": {
 *     "rootEntityType": "Account",
 *     "rootIds": ["001A"],
 *     "children": [{"entityType": "Contact", "parentEntityType": "Account", "parentField": "AccountId"}],
 *     "continuity": [{"entityType": "User", "fallbackWhere": {"IsActive": ["true"]}}],
 *     "dummies": {"Opportunity": {"values": {"StageName": "Prospecting", "CloseDate": "@today+30d"}}}
 *   },
 *   "settings": {"batchSize": 100}
 * }
 * </pre>
 */
public record MigrationConfig(
    ConnectionConfig source,
    ConnectionConfig target,
    String metadataDirectory,
    String snapshotDirectory,
    PlanConfig plan,
    SettingsConfig settings
) {
    public static final String DEFAULT_SNAPSHOT_DIRECTORY = "migration_data";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * @param accessTokenEnv environment variable holding the token, used when {@code accessToken} is absent
     */
    public record ConnectionConfig(
        String uri,
        String accessToken,
        String accessTokenEnv,
        String apiVersion,
        Boolean insecure,
        Integer maxConnections
    ) {
        public ConnectionContext toContext(Function<String, String> environment) {
            String token = accessToken;
            if (token == null && accessTokenEnv != null) {
                token = environment.apply(accessTokenEnv);
                if (token == null) {
                    throw new IllegalArgumentException("Environment variable " + accessTokenEnv + " is not set");
                }
            }
            return new ConnectionContext(uri, token, apiVersion, Boolean.TRUE.equals(insecure));
        }
    }

    public record ChildConfig(String entityType, String parentEntityType, String parentField, Integer limit) {
        ChildSpec toChildSpec(String rootEntityType) {
            require(entityType, "plan.children[].entityType");
            require(parentField, "plan.children[].parentField");
            return new ChildSpec(entityType,
                parentEntityType != null ? parentEntityType : rootEntityType,
                parentField,
                limit != null ? limit : RecordQuery.NO_LIMIT);
        }
    }

    /**
     * {@code fallbackWhere} maps a field to accepted values; a record matching any entry qualifies.
     */
    public record ContinuityConfig(String entityType, String fallbackId, Map<String, List<String>> fallbackWhere) {
        IdentityContinuityResolver.Policy toPolicy() {
            require(entityType, "plan.continuity[].entityType");
            RecordQuery fallbackQuery = null;
            if (fallbackWhere != null && !fallbackWhere.isEmpty()) {
                for (var entry : fallbackWhere.entrySet()) {
                    fallbackQuery = fallbackQuery == null
                        ? RecordQuery.where(entityType, entry.getKey(), entry.getValue())
                        : fallbackQuery.or(entry.getKey(), entry.getValue());
                }
            }
            return new IdentityContinuityResolver.Policy(entityType, fallbackId, fallbackQuery);
        }
    }

    /** {@code references} points a placeholder field at another type's placeholder. */
    public record DummyConfig(Map<String, Object> values, Map<String, String> references) {
        DummyTemplate toTemplate(DateTokens dateTokens) {
            var resolved = new LinkedHashMap<String, Object>();
            if (values != null) {
                values.forEach((field, value) -> resolved.put(field, dateTokens.resolve(value)));
            }
            return new DummyTemplate(resolved, references);
        }
    }

    public record PlanConfig(
        String rootEntityType,
        List<String> rootIds,
        Integer prefetchLimit,
        List<String> discoveryFields,
        List<ChildConfig> children,
        List<String> backpatchOrder,
        List<ContinuityConfig> continuity,
        List<String> stableNameTypes,
        List<String> referencedTypes,
        Map<String, DummyConfig> dummies,
        String keptDummyType
    ) {
        public MigrationPlan toPlan(DateTokens dateTokens) {
            require(rootEntityType, "plan.rootEntityType");
            var builder = MigrationPlan.builder()
                .rootEntityType(rootEntityType)
                .rootIds(orEmpty(rootIds))
                .discoveryFields(orEmpty(discoveryFields))
                .backpatchOrder(orEmpty(backpatchOrder))
                .stableNameTypes(orEmpty(stableNameTypes))
                .referencedTypes(orEmpty(referencedTypes))
                .keptDummyType(keptDummyType);
            if (prefetchLimit != null) {
                builder.prefetchLimit(prefetchLimit);
            }
            orEmpty(children).forEach(child -> builder.child(child.toChildSpec(rootEntityType)));
            orEmpty(continuity).forEach(policy -> builder.continuity(policy.toPolicy()));
            if (dummies != null) {
                dummies.forEach((type, dummy) -> builder.dummyTemplate(type, dummy.toTemplate(dateTokens)));
            }
            return builder.build();
        }
    }

    public record SettingsConfig(
        Integer batchSize,
        Long flushTimeoutSeconds,
        Integer flushAttempts,
        Boolean batchedCreation,
        Boolean resolveSameTypeDependencies,
        Boolean purgeDummies,
        Boolean deleteExisting,
        Boolean resume,
        Boolean maskEmails
    ) {
        public MigrationSettings.MigrationSettingsBuilder toBuilder() {
            var builder = MigrationSettings.builder();
            if (batchSize != null) {
                if (batchSize < 1) {
                    throw new IllegalArgumentException("settings.batchSize must be positive, was " + batchSize);
                }
                builder.batchSize(batchSize);
            }
            if (flushTimeoutSeconds != null) {
                builder.flushTimeout(Duration.ofSeconds(flushTimeoutSeconds));
            }
            if (flushAttempts != null) {
                builder.flushAttempts(flushAttempts);
            }
            if (batchedCreation != null) {
                builder.batchedCreation(batchedCreation);
            }
            if (resolveSameTypeDependencies != null) {
                builder.resolveSameTypeDependencies(resolveSameTypeDependencies);
            }
            if (purgeDummies != null) {
                builder.purgeDummies(purgeDummies);
            }
            if (deleteExisting != null) {
                builder.deleteExisting(deleteExisting);
            }
            if (resume != null) {
                builder.resume(resume);
            }
            if (maskEmails != null) {
                builder.maskEmails(maskEmails);
            }
            return builder;
        }
    }

    public static MigrationConfig load(Path file) throws IOException {
        try (var in = Files.newInputStream(file)) {
            return parse(MAPPER.readValue(in, MigrationConfig.class));
        }
    }

    public static MigrationConfig parse(String json) throws IOException {
        return parse(MAPPER.readValue(json, MigrationConfig.class));
    }

    private static MigrationConfig parse(MigrationConfig config) {
        if (config.source() == null || config.target() == null) {
            throw new IllegalArgumentException("Both source and target connections must be configured");
        }
        if (config.plan() == null) {
            throw new IllegalArgumentException("A plan must be configured");
        }
        return config;
    }

    public Path snapshotPath() {
        return Path.of(snapshotDirectory != null ? snapshotDirectory : DEFAULT_SNAPSHOT_DIRECTORY);
    }

    public MigrationSettings.MigrationSettingsBuilder settingsBuilder() {
        return settings != null ? settings.toBuilder() : MigrationSettings.builder();
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    private static void require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must be set");
        }
    }
}
