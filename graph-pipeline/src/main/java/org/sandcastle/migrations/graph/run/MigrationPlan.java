package org.sandcastle.migrations.graph.run;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.sandcastle.migrations.graph.identity.DummyTemplate;
import org.sandcastle.migrations.graph.identity.IdentityContinuityResolver;
import org.sandcastle.migrations.graph.store.RecordQuery;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

/**
 * What one run copies: a set of root records, the records discovered through them, and the
 * child types hanging off migrated parents.
 */
@Getter
@Builder
@ToString
public class MigrationPlan {

    /**
     * Child records of {@code entityType} are those whose {@code parentField} holds the source id
     * of a migrated {@code parentEntityType} record. A limit caps the children read per parent.
     */
    public record ChildSpec(String entityType, String parentEntityType, String parentField, int limit) {
        public static ChildSpec of(String entityType, String parentEntityType, String parentField) {
            return new ChildSpec(entityType, parentEntityType, parentField, RecordQuery.NO_LIMIT);
        }

        public boolean isLimited() {
            return limit >= 0;
        }
    }

    @NonNull
    private final String rootEntityType;
    @Singular
    private final List<String> rootIds;
    /** Root-type fields that pull in every record pointing at a root. Empty means its same-type references. */
    @Singular
    private final List<String> discoveryFields;
    @Builder.Default
    private final int prefetchLimit = RecordQuery.NO_LIMIT;
    @Singular("child")
    private final List<ChildSpec> children;
    /** Order of Phase 2. Empty means roots first, then children in plan order. */
    @Singular("backpatch")
    private final List<String> backpatchOrder;
    @Singular("continuity")
    private final List<IdentityContinuityResolver.Policy> continuity;
    @Singular
    private final Set<String> stableNameTypes;
    @Singular
    private final Map<String, DummyTemplate> dummyTemplates;
    /** Types described up front only because something references them. */
    @Singular
    private final Set<String> referencedTypes;
    /** The placeholder that survives the end-of-run purge. Defaults to the root type's. */
    private final String keptDummyType;

    /** Root type first, then child types, in plan order. */
    public List<String> migratedEntityTypes() {
        var types = new LinkedHashSet<String>();
        types.add(rootEntityType);
        children.forEach(child -> types.add(child.entityType()));
        return new ArrayList<>(types);
    }

    public List<String> metadataEntityTypes() {
        var types = new LinkedHashSet<>(migratedEntityTypes());
        types.addAll(referencedTypes);
        return new ArrayList<>(types);
    }

    public List<String> effectiveBackpatchOrder() {
        return backpatchOrder.isEmpty() ? migratedEntityTypes() : backpatchOrder;
    }

    public String effectiveKeptDummyType() {
        return keptDummyType != null ? keptDummyType : rootEntityType;
    }
}
