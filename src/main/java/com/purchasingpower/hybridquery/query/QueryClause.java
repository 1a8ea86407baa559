package com.purchasingpower.hybridquery.query;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Node of the logical query tree.
 *
 * <p>The variant is closed: a clause is a {@link QueryComponent}, a
 * {@link LogicalGroup} or a {@link NotClause}. Code that needs to branch on the
 * kind of clause does so through {@link #accept(ClauseVisitor)}.
 *
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = QueryComponent.class, name = "component"),
    @JsonSubTypes.Type(value = LogicalGroup.class, name = "group"),
    @JsonSubTypes.Type(value = NotClause.class, name = "not")
})
public interface QueryClause {

    <R> R accept(ClauseVisitor<R> visitor);
}
