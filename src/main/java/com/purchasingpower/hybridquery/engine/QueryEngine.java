package com.purchasingpower.hybridquery.engine;

import com.purchasingpower.hybridquery.planner.PlannedQuery;
import com.purchasingpower.hybridquery.query.ComplexQuery;
import com.purchasingpower.hybridquery.query.QueryResult;

/**
 * Entry point for running complex queries across the relational, vector and
 * graph stores.
 *
 * <p>Planning problems are thrown; execution problems are returned inside the
 * {@link QueryResult}. Callers should check {@link QueryResult#hasErrors()} even
 * when objects were found.
 *
 * @since 1.0.0
 */
public interface QueryEngine {

    /**
     * Validate and plan a query without executing it.
     *
     * @throws com.purchasingpower.hybridquery.exception.QueryEngineException on any planning problem
     */
    PlannedQuery plan(ComplexQuery query);

    /**
     * Plan and execute a query.
     *
     * @throws com.purchasingpower.hybridquery.exception.QueryEngineException on any planning problem
     */
    QueryResult execute(ComplexQuery query);
}
