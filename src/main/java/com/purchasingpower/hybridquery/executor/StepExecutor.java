package com.purchasingpower.hybridquery.executor;

import com.purchasingpower.hybridquery.planner.PlannedStep;
import com.purchasingpower.hybridquery.planner.StepKind;

import java.util.Set;

/**
 * Executes one kind of plan step. Implementations are Spring beans picked up by
 * the query executor, one per {@link StepKind}.
 *
 * @param <S> step type handled
 * @since 1.0.0
 */
public interface StepExecutor<S extends PlannedStep> {

    StepKind kind();

    Class<S> stepType();

    /**
     * Run the step.
     *
     * @param step step to run
     * @param restrictTo current candidate ids, or {@code null} when unconstrained
     * @return ids passing the step
     */
    Set<String> execute(S step, Set<String> restrictTo);
}
