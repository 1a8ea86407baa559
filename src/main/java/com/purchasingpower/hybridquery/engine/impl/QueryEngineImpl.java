package com.purchasingpower.hybridquery.engine.impl;

import com.purchasingpower.hybridquery.configuration.QueryEngineProperties;
import com.purchasingpower.hybridquery.engine.QueryEngine;
import com.purchasingpower.hybridquery.executor.QueryExecutor;
import com.purchasingpower.hybridquery.planner.PlannedQuery;
import com.purchasingpower.hybridquery.planner.QueryPlanner;
import com.purchasingpower.hybridquery.query.ComplexQuery;
import com.purchasingpower.hybridquery.query.QueryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Plans queries, then executes them either on the calling thread or, when a
 * timeout is configured, on the query pool with a bounded wait.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class QueryEngineImpl implements QueryEngine {

    private final QueryPlanner planner;
    private final QueryExecutor executor;
    private final ThreadPoolTaskExecutor queryExecutor;
    private final QueryEngineProperties properties;

    public QueryEngineImpl(QueryPlanner planner,
                           QueryExecutor executor,
                           @Qualifier("queryExecutor") ThreadPoolTaskExecutor queryExecutor,
                           QueryEngineProperties properties) {
        this.planner = planner;
        this.executor = executor;
        this.queryExecutor = queryExecutor;
        this.properties = properties;
    }

    @Override
    public PlannedQuery plan(ComplexQuery query) {
        return planner.plan(query);
    }

    @Override
    public QueryResult execute(ComplexQuery query) {
        PlannedQuery plan = planner.plan(query);
        long timeoutMs = properties.getExecutor().getTimeoutMs();
        if (timeoutMs <= 0) {
            return executor.execute(plan);
        }

        Future<QueryResult> future;
        try {
            future = queryExecutor.submit(() -> executor.execute(plan));
        } catch (TaskRejectedException e) {
            log.error("❌ Query executor rejected '{}': {}", plan.getDescription(), e.getMessage());
            return QueryResult.failed("Query rejected: executor is saturated");
        }

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⏱️  Query '{}' timed out after {} ms", plan.getDescription(), timeoutMs);
            return QueryResult.failed("Query timed out after " + timeoutMs + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return QueryResult.failed("Query execution was interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("❌ Query '{}' failed: {}", plan.getDescription(), cause.getMessage(), cause);
            return QueryResult.failed("Error evaluating query: " + cause.getMessage());
        }
    }
}
