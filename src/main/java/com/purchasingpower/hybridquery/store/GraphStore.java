package com.purchasingpower.hybridquery.store;

import com.purchasingpower.hybridquery.query.GraphTraversalClause;

import java.util.Set;

/**
 * Graph collaborator: filters objects by their relationships.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    /**
     * Ids of objects of {@code sourceObjectTypeName} having at least one edge of the
     * clause's relation type, in the clause's direction, to an object of the target
     * type that satisfies every target filter.
     *
     * @param sourceObjectTypeName type of the objects being filtered
     * @param traversal relation, direction, target type and target filters
     * @param restrictTo candidate ids, or {@code null} for the whole type
     * @return matching ids, a subset of {@code restrictTo} when it is set
     */
    Set<String> filterByTraversal(String sourceObjectTypeName, GraphTraversalClause traversal, Set<String> restrictTo);
}
