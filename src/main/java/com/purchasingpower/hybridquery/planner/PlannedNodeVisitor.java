package com.purchasingpower.hybridquery.planner;

/**
 * Single recursive entry point over a planned tree.
 *
 * @param <R> per-node result
 */
public interface PlannedNodeVisitor<R> {

    R visitComponent(PlannedComponentExecution component);

    R visitGroup(PlannedLogicalGroup group);

    R visitNot(PlannedNotClause not);
}
