package com.purchasingpower.hybridquery.planner;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PlannedNotClause implements PlannedNode {

    String objectTypeName;
    PlannedNode child;

    @Override
    public <R> R accept(PlannedNodeVisitor<R> visitor) {
        return visitor.visitNot(this);
    }
}
