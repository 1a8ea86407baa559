package com.purchasingpower.hybridquery.query;

import com.purchasingpower.hybridquery.exception.QueryException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A query over one or more object types, expressed as a clause tree.
 *
 * <p>{@code components} is the deprecated flat form; it is equivalent to an AND
 * group over the listed components. Exactly one of {@code queryRoot} and
 * {@code components} must be set.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class ComplexQuery {

    String description;

    QueryClause queryRoot;

    /**
     * @deprecated use {@link #getQueryRoot()} with a {@link LogicalGroup}
     */
    @Deprecated
    List<QueryComponent> components;

    /**
     * Root clause to plan, with the legacy component list desugared into an
     * implicit AND group.
     *
     * @throws QueryException if neither or both forms are present
     */
    @SuppressWarnings("deprecation")
    public QueryClause resolveRoot() {
        boolean hasComponents = components != null && !components.isEmpty();
        if (queryRoot != null && hasComponents) {
            throw new QueryException("Cannot specify both 'queryRoot' and 'components'");
        }
        if (queryRoot != null) {
            return queryRoot;
        }
        if (hasComponents) {
            return LogicalGroup.builder()
                .operator(LogicalOperator.AND)
                .clauses(components)
                .build();
        }
        throw new QueryException("Must specify either 'queryRoot' or 'components'");
    }

    public static ComplexQuery of(QueryClause root) {
        return ComplexQuery.builder().queryRoot(root).build();
    }
}
