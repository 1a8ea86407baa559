package com.purchasingpower.hybridquery.query;

/**
 * Single recursive entry point over the clause tree.
 *
 * @param <R> result of visiting one clause
 * @since 1.0.0
 */
public interface ClauseVisitor<R> {

    R visitComponent(QueryComponent component);

    R visitGroup(LogicalGroup group);

    R visitNot(NotClause not);
}
