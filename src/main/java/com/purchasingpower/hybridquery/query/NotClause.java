package com.purchasingpower.hybridquery.query;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Complement of a child clause within the full extent of its object type.
 * Nested negations are kept as written.
 */
@Value
@Builder
@Jacksonized
public class NotClause implements QueryClause {

    QueryClause clause;

    @Override
    public <R> R accept(ClauseVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    public static NotClause of(QueryClause clause) {
        return new NotClause(clause);
    }
}
