package com.purchasingpower.hybridquery.executor.impl;

import com.purchasingpower.hybridquery.executor.StepExecutor;
import com.purchasingpower.hybridquery.model.CallContext;
import com.purchasingpower.hybridquery.model.ServiceType;
import com.purchasingpower.hybridquery.planner.GraphTraversalStep;
import com.purchasingpower.hybridquery.planner.StepKind;
import com.purchasingpower.hybridquery.query.GraphTraversalClause;
import com.purchasingpower.hybridquery.store.GraphStore;
import com.purchasingpower.hybridquery.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class GraphTraversalStepExecutor implements StepExecutor<GraphTraversalStep> {

    private final GraphStore graphStore;

    @Override
    public StepKind kind() {
        return StepKind.GRAPH_TRAVERSAL;
    }

    @Override
    public Class<GraphTraversalStep> stepType() {
        return GraphTraversalStep.class;
    }

    @Override
    public Set<String> execute(GraphTraversalStep step, Set<String> restrictTo) {
        GraphTraversalClause traversal = step.getTraversal();
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GRAPH, "filterByTraversal", log);
        ctx.logRequest(step.getObjectTypeName() + " " + traversal.getDirection() + " "
                + traversal.getRelationTypeName() + " " + traversal.getTargetObjectTypeName(),
            "targetFilters", traversal.getTargetFilters(),
            "restrictTo", ExternalCallLogger.formatIds(restrictTo));
        try {
            Set<String> ids = graphStore.filterByTraversal(step.getObjectTypeName(), traversal, restrictTo);
            ctx.logResponse(ids.size());
            return ids;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }
}
