package com.purchasingpower.hybridquery.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Schema of a relationship between object types (an edge type in the graph store).
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class RelationTypeDefinition {

    String name;
    String description;

    @Singular
    List<String> sourceObjectTypeNames;

    @Singular
    List<String> targetObjectTypeNames;

    @Singular("property")
    List<PropertyDefinition> properties;

    public boolean allowsSource(String objectTypeName) {
        return sourceObjectTypeNames.contains(objectTypeName);
    }

    public boolean allowsTarget(String objectTypeName) {
        return targetObjectTypeNames.contains(objectTypeName);
    }
}
