package com.purchasingpower.hybridquery.api;

import com.purchasingpower.hybridquery.engine.QueryEngine;
import com.purchasingpower.hybridquery.exception.QueryEngineException;
import com.purchasingpower.hybridquery.planner.PlannedQuery;
import com.purchasingpower.hybridquery.query.ComplexQuery;
import com.purchasingpower.hybridquery.query.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for complex queries.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/query")
@RequiredArgsConstructor
public class QueryController {

    private final QueryEngine queryEngine;

    /**
     * Plan and execute a query.
     *
     * POST /api/v1/query
     */
    @PostMapping
    public ResponseEntity<QueryResponse> query(@RequestBody ComplexQuery request) {
        try {
            log.info("Query: {}", request.getDescription());
            QueryResult result = queryEngine.execute(request);
            return ResponseEntity.ok(QueryResponse.success(result));

        } catch (QueryEngineException e) {
            log.warn("Query rejected: {}", e.getMessage());
            return ResponseEntity.badRequest()
                .body(QueryResponse.error(e.getErrors()));
        } catch (Exception e) {
            log.error("Query failed", e);
            return ResponseEntity.internalServerError()
                .body(QueryResponse.error(List.of("Query failed: " + e.getMessage())));
        }
    }

    /**
     * Validate and plan a query without executing it.
     *
     * POST /api/v1/query/plan
     */
    @PostMapping("/plan")
    public ResponseEntity<PlanResponse> plan(@RequestBody ComplexQuery request) {
        try {
            PlannedQuery plan = queryEngine.plan(request);
            return ResponseEntity.ok(PlanResponse.success(plan));

        } catch (QueryEngineException e) {
            log.warn("Plan rejected: {}", e.getMessage());
            return ResponseEntity.badRequest()
                .body(PlanResponse.error(e.getErrors()));
        } catch (Exception e) {
            log.error("Planning failed", e);
            return ResponseEntity.internalServerError()
                .body(PlanResponse.error(List.of("Planning failed: " + e.getMessage())));
        }
    }
}
