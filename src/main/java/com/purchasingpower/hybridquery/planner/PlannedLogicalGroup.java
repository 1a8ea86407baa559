package com.purchasingpower.hybridquery.planner;

import com.purchasingpower.hybridquery.query.LogicalOperator;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PlannedLogicalGroup implements PlannedNode {

    LogicalOperator operator;
    String objectTypeName;

    @Singular("child")
    List<PlannedNode> children;

    @Override
    public <R> R accept(PlannedNodeVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }
}
