package com.purchasingpower.hybridquery.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Leaf of the query tree: a conjunction of conditions on one object type.
 *
 * <p>Relational filters, embedding searches and graph traversals are all ANDed.
 * A component without conditions matches every object of its type.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class QueryComponent implements QueryClause {

    String objectTypeName;

    @Singular
    List<RelationalFilter> relationalFilters;

    @Singular("embeddingSearch")
    List<EmbeddingSearchClause> embeddingSearches;

    @Singular
    List<GraphTraversalClause> graphTraversals;

    @Override
    public <R> R accept(ClauseVisitor<R> visitor) {
        return visitor.visitComponent(this);
    }

    public static QueryComponent of(String objectTypeName, RelationalFilter... filters) {
        return QueryComponent.builder()
            .objectTypeName(objectTypeName)
            .relationalFilters(List.of(filters))
            .build();
    }
}
