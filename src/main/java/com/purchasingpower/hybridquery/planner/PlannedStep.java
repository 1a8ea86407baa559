package com.purchasingpower.hybridquery.planner;

import lombok.Getter;

/**
 * One store call within a planned component. Steps of a component run in order,
 * each narrowing the candidate set left by the previous one.
 *
 * @since 1.0.0
 */
@Getter
public abstract class PlannedStep {

    private final StepKind kind;
    private final String objectTypeName;

    protected PlannedStep(StepKind kind, String objectTypeName) {
        this.kind = kind;
        this.objectTypeName = objectTypeName;
    }
}
