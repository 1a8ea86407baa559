package com.purchasingpower.hybridquery.core;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Declares how vectors are produced for one property of an object type.
 *
 * <p>{@code dimensions} is optional; when present the planner checks query
 * vectors against it.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class EmbeddingDefinition {

    String name;
    String objectTypeName;
    String sourcePropertyName;
    String embeddingModel;
    Integer dimensions;
    String description;
}
