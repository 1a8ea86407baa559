package com.purchasingpower.hybridquery.planner;

import com.purchasingpower.hybridquery.query.ComplexQuery;

/**
 * Validates a query against the schema and decomposes it into a planned tree.
 *
 * @since 1.0.0
 */
public interface QueryPlanner {

    /**
     * Plan a query. No store is touched.
     *
     * @param query query to plan
     * @return executable plan
     * @throws com.purchasingpower.hybridquery.exception.QueryException if the query has no root or an ambiguous one
     * @throws com.purchasingpower.hybridquery.exception.SchemaException if any schema problem was found;
     *         the exception lists every problem, including value problems
     * @throws com.purchasingpower.hybridquery.exception.ValidationException if only value problems were found
     */
    PlannedQuery plan(ComplexQuery query);
}
