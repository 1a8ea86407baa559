package com.purchasingpower.hybridquery.planner;

import com.purchasingpower.hybridquery.core.RelationTypeDefinition;
import com.purchasingpower.hybridquery.query.GraphTraversalClause;
import lombok.Getter;
import lombok.ToString;

/**
 * One relationship traversal, with its relation type already resolved.
 */
@Getter
@ToString
public class GraphTraversalStep extends PlannedStep {

    private final GraphTraversalClause traversal;
    private final RelationTypeDefinition relationType;

    public GraphTraversalStep(String objectTypeName, GraphTraversalClause traversal,
                              RelationTypeDefinition relationType) {
        super(StepKind.GRAPH_TRAVERSAL, objectTypeName);
        this.traversal = traversal;
        this.relationType = relationType;
    }
}
