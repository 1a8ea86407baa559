package com.purchasingpower.hybridquery.planner;

import com.purchasingpower.hybridquery.query.QueryComponent;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A query component decomposed into ordered steps.
 *
 * <p>{@code componentIndex} numbers components in pre-order across the whole
 * tree, starting at 0; execution errors refer to components by this index.
 */
@Value
@Builder
public class PlannedComponentExecution implements PlannedNode {

    int componentIndex;
    String objectTypeName;

    @Singular
    List<PlannedStep> steps;

    QueryComponent originalComponent;

    @Override
    public <R> R accept(PlannedNodeVisitor<R> visitor) {
        return visitor.visitComponent(this);
    }
}
