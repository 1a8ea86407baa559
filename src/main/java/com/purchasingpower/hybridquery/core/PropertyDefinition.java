package com.purchasingpower.hybridquery.core;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Single property of an object or relation type.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class PropertyDefinition {

    String name;
    PropertyDataType dataType;

    @Builder.Default
    boolean primaryKey = false;

    @Builder.Default
    boolean nullable = true;

    @Builder.Default
    boolean unique = false;

    @Builder.Default
    boolean indexed = false;

    String description;

    public static PropertyDefinition of(String name, PropertyDataType dataType) {
        return PropertyDefinition.builder().name(name).dataType(dataType).build();
    }
}
