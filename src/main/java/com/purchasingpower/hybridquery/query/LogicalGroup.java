package com.purchasingpower.hybridquery.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Combines child clauses with AND (intersection) or OR (union).
 *
 * <p>A group must have at least one child; a single child passes through unchanged.
 */
@Value
@Builder
@Jacksonized
public class LogicalGroup implements QueryClause {

    LogicalOperator operator;

    @Singular("clause")
    List<QueryClause> clauses;

    @Override
    public <R> R accept(ClauseVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    public static LogicalGroup and(QueryClause... clauses) {
        return new LogicalGroup(LogicalOperator.AND, List.of(clauses));
    }

    public static LogicalGroup or(QueryClause... clauses) {
        return new LogicalGroup(LogicalOperator.OR, List.of(clauses));
    }
}
