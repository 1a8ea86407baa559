package com.purchasingpower.hybridquery.planner;

import com.purchasingpower.hybridquery.query.RelationalFilter;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * All relational filters of a component, applied in one store call.
 */
@Getter
@ToString
public class RelationalFilterStep extends PlannedStep {

    private final List<RelationalFilter> filters;

    public RelationalFilterStep(String objectTypeName, List<RelationalFilter> filters) {
        super(StepKind.RELATIONAL_FILTER, objectTypeName);
        this.filters = List.copyOf(filters);
    }
}
