package com.purchasingpower.hybridquery.schema;

import com.purchasingpower.hybridquery.core.EmbeddingDefinition;
import com.purchasingpower.hybridquery.core.ObjectTypeDefinition;
import com.purchasingpower.hybridquery.core.RelationTypeDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON snapshot of a schema, as read by {@link SchemaLoader}.
 *
 * <pre>
 * {
 *   "objectTypes": [ { "name": "Car", "properties": [ { "name": "color", "dataType": "TEXT" } ] } ],
 *   "relationTypes": [ { "name": "LocatedIn", "sourceObjectTypeNames": ["Car"], "targetObjectTypeNames": ["City"] } ],
 *   "embeddingDefinitions": [ { "name": "car_description", "objectTypeName": "Car", "sourcePropertyName": "description" } ]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaDocument {

    @Builder.Default
    private List<ObjectTypeDefinition> objectTypes = new ArrayList<>();

    @Builder.Default
    private List<RelationTypeDefinition> relationTypes = new ArrayList<>();

    @Builder.Default
    private List<EmbeddingDefinition> embeddingDefinitions = new ArrayList<>();
}
