package com.purchasingpower.hybridquery.planner;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of store call a plan step performs.
 */
public enum StepKind {
    RELATIONAL_FILTER("relational_filter"),
    EMBEDDING_SEARCH("embedding_search"),
    GRAPH_TRAVERSAL("graph_traversal");

    private final String value;

    StepKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
