package com.purchasingpower.hybridquery.planner;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Node of a planned tree. Every node resolves to exactly one object type.
 *
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PlannedComponentExecution.class, name = "component"),
    @JsonSubTypes.Type(value = PlannedLogicalGroup.class, name = "group"),
    @JsonSubTypes.Type(value = PlannedNotClause.class, name = "not")
})
public interface PlannedNode {

    String getObjectTypeName();

    <R> R accept(PlannedNodeVisitor<R> visitor);
}
