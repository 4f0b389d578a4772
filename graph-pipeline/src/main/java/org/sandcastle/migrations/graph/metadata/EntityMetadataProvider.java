package org.sandcastle.migrations.graph.metadata;

import java.io.IOException;
import java.util.List;

import org.sandcastle.migrations.graph.ir.FieldSpec;

/**
 * Schema introspection: the insertable fields of one entity type.
 */
@FunctionalInterface
public interface EntityMetadataProvider {
    List<FieldSpec> describeEntity(String entityType) throws IOException;
}
