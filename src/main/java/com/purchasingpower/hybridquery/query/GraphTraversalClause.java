package com.purchasingpower.hybridquery.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Keeps only objects that have an edge of {@code relationTypeName} in the given
 * direction to an object of {@code targetObjectTypeName} which satisfies every
 * target filter (and, when set, has id {@code targetObjectId}).
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class GraphTraversalClause {

    String relationTypeName;

    @Builder.Default
    TraversalDirection direction = TraversalDirection.OUTGOING;

    String targetObjectTypeName;
    String targetObjectId;

    @Singular
    List<RelationalFilter> targetFilters;
}
