package com.purchasingpower.hybridquery.schema;

import com.purchasingpower.hybridquery.core.EmbeddingDefinition;
import com.purchasingpower.hybridquery.core.ObjectTypeDefinition;
import com.purchasingpower.hybridquery.core.RelationTypeDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the schema used while planning.
 *
 * <p>Creating and deleting definitions is owned by the schema management layer;
 * the query engine only looks definitions up.
 *
 * @since 1.0.0
 */
public interface SchemaRegistry {

    /**
     * Get an object type definition by name.
     *
     * @param name object type name
     * @return definition if known
     */
    Optional<ObjectTypeDefinition> getObjectType(String name);

    /**
     * Get a relation type definition by name.
     *
     * @param name relation type name
     * @return definition if known
     */
    Optional<RelationTypeDefinition> getRelationType(String name);

    /**
     * Get an embedding definition by name.
     *
     * @param name embedding definition name
     * @return definition if known
     */
    Optional<EmbeddingDefinition> getEmbeddingDefinition(String name);

    List<ObjectTypeDefinition> listObjectTypes();

    List<RelationTypeDefinition> listRelationTypes();

    List<EmbeddingDefinition> listEmbeddingDefinitions();
}
