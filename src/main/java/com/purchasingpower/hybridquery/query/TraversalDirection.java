package com.purchasingpower.hybridquery.query;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Direction of an edge, seen from the objects being filtered.
 *
 * @since 1.0.0
 */
public enum TraversalDirection {
    OUTGOING,
    INCOMING;

    @JsonCreator
    public static TraversalDirection fromValue(String value) {
        return TraversalDirection.valueOf(value.trim().toUpperCase());
    }
}
