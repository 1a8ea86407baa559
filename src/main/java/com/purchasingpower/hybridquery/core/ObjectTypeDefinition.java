package com.purchasingpower.hybridquery.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * Schema of a category of objects (a table in the relational store, a node label
 * in the graph store).
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class ObjectTypeDefinition {

    String name;
    String description;

    @Singular("property")
    List<PropertyDefinition> properties;

    /**
     * Look up a property by exact name.
     */
    public Optional<PropertyDefinition> findProperty(String propertyName) {
        return properties.stream()
            .filter(p -> p.getName().equals(propertyName))
            .findFirst();
    }
}
