package com.purchasingpower.hybridquery.executor;

import com.purchasingpower.hybridquery.planner.PlannedQuery;
import com.purchasingpower.hybridquery.query.QueryResult;

/**
 * Runs a planned query against the store collaborators.
 *
 * @since 1.0.0
 */
public interface QueryExecutor {

    /**
     * Execute a plan. Never throws: store failures are recovered per branch and
     * listed in {@link QueryResult#getErrors()}.
     */
    QueryResult execute(PlannedQuery plan);
}
