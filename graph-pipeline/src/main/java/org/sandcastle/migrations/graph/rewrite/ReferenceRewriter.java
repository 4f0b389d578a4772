package org.sandcastle.migrations.graph.rewrite;

import java.util.LinkedHashMap;
import java.util.Optional;

import org.sandcastle.migrations.graph.FatalSetupException;
import org.sandcastle.migrations.graph.identity.DummyRegistry;
import org.sandcastle.migrations.graph.identity.IdentityContinuityResolver;
import org.sandcastle.migrations.graph.identity.IdentityMap;
import org.sandcastle.migrations.graph.identity.StableNameCache;
import org.sandcastle.migrations.graph.ir.EntityType;
import org.sandcastle.migrations.graph.ir.FieldSpec;
import org.sandcastle.migrations.graph.ir.SourceRecord;
import org.sandcastle.migrations.graph.metadata.EntityMetadata;
import org.sandcastle.migrations.graph.store.RecordQuery;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a source record into a creation payload for the target.
 *
 * A reference is written as, in order of preference: the same identity for continuity types,
 * the stable-name equivalent for stable-name types, the mapped target id, or the type's
 * placeholder when the field is required. Optional references that cannot be resolved yet are
 * left out for Phase 2 to restore. Only fields known to the metadata are sent.
 *
 * Reads shared state but never writes it, so rewriting the same record twice gives equal results.
 */
@Slf4j
@RequiredArgsConstructor
public class ReferenceRewriter {

    private final EntityMetadata metadata;
    private final IdentityMap identityMap;
    private final DummyRegistry dummies;
    private final IdentityContinuityResolver continuity;
    private final StableNameCache stableNames;
    private final ScalarFieldSanitizer sanitizer;

    public RewrittenRecord rewrite(SourceRecord record) {
        EntityType type = metadata.describe(record.entityType());
        var payload = new LinkedHashMap<String, Object>();
        var writtenReferences = new LinkedHashMap<String, String>();

        for (FieldSpec field : type.fields()) {
            if (RecordQuery.ID_FIELD.equals(field.name()) || !record.fields().containsKey(field.name())) {
                continue;
            }
            if (field.isReference()) {
                resolveReference(record, field).ifPresent(targetRef -> {
                    payload.put(field.name(), targetRef);
                    writtenReferences.put(field.name(), targetRef);
                });
            } else {
                sanitizer.sanitize(record.entityType(), field, record.get(field.name()))
                    .ifPresent(value -> payload.put(field.name(), value));
            }
        }
        return new RewrittenRecord(record.entityType(), record.id(), payload, writtenReferences);
    }

    private Optional<String> resolveReference(SourceRecord record, FieldSpec field) {
        String sourceRef = record.reference(field.name());
        if (sourceRef == null) {
            return Optional.empty();
        }
        String referencedType = field.referencedType();
        if (continuity.handles(referencedType)) {
            return continuity.resolve(referencedType, sourceRef);
        }
        if (stableNames.handles(referencedType)) {
            Optional<String> stable = stableNames.resolve(record.entityType(), sourceRef);
            if (stable.isEmpty() && field.required()) {
                log.warn("{} {}: no target {} matches {}, leaving required {} unset",
                    record.entityType(), record.id(), referencedType, sourceRef, field.name());
            }
            return stable;
        }
        Optional<String> resolved = identityMap.lookup(referencedType, sourceRef);
        if (resolved.isPresent() || !field.required()) {
            return resolved;
        }
        String dummyId = dummies.lookup(referencedType).orElseThrow(() -> new FatalSetupException(
            "No placeholder " + referencedType + " for required reference " + record.entityType() + "." + field.name()));
        log.atDebug().setMessage("{} {}: {} -> placeholder {}")
            .addArgument(record.entityType()).addArgument(record.id()).addArgument(field.name()).addArgument(dummyId).log();
        return Optional.of(dummyId);
    }
}
