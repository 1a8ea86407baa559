package com.purchasingpower.hybridquery.store.impl;

import com.purchasingpower.hybridquery.query.GraphTraversalClause;
import com.purchasingpower.hybridquery.query.TraversalDirection;
import com.purchasingpower.hybridquery.store.GraphStore;
import com.purchasingpower.hybridquery.store.RelationalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Graph store keeping typed edges in memory, grouped by relation type.
 *
 * <p>Target-side filters are evaluated by the relational store against the target
 * object type, so target properties live in one place.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "hybrid-query.store", name = "graph", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryGraphStore implements GraphStore {

    private final RelationalStore relationalStore;

    private final Map<String, List<Edge>> edgesByRelation = new ConcurrentHashMap<>();

    public void addEdge(String relationTypeName, String sourceObjectTypeName, String sourceId,
                        String targetObjectTypeName, String targetId) {
        edgesByRelation.computeIfAbsent(relationTypeName, r -> new CopyOnWriteArrayList<>())
            .add(new Edge(sourceObjectTypeName, sourceId, targetObjectTypeName, targetId));
    }

    public void clear() {
        edgesByRelation.clear();
    }

    @Override
    public Set<String> filterByTraversal(String sourceObjectTypeName, GraphTraversalClause traversal,
                                         Set<String> restrictTo) {
        boolean outgoing = traversal.getDirection() != TraversalDirection.INCOMING;
        String targetType = traversal.getTargetObjectTypeName();

        // self = the object being filtered, other = the far end of the edge
        List<String[]> pairs = new ArrayList<>();
        Set<String> otherIds = new LinkedHashSet<>();
        for (Edge edge : edgesByRelation.getOrDefault(traversal.getRelationTypeName(), List.of())) {
            String selfType = outgoing ? edge.sourceType() : edge.targetType();
            String otherType = outgoing ? edge.targetType() : edge.sourceType();
            if (!selfType.equals(sourceObjectTypeName) || !otherType.equals(targetType)) {
                continue;
            }
            String self = outgoing ? edge.sourceId() : edge.targetId();
            String other = outgoing ? edge.targetId() : edge.sourceId();
            if (restrictTo != null && !restrictTo.contains(self)) {
                continue;
            }
            if (traversal.getTargetObjectId() != null && !traversal.getTargetObjectId().equals(other)) {
                continue;
            }
            pairs.add(new String[]{self, other});
            otherIds.add(other);
        }

        Set<String> matchingOthers = otherIds;
        if (!traversal.getTargetFilters().isEmpty() && !otherIds.isEmpty()) {
            matchingOthers = relationalStore.filterIds(targetType, traversal.getTargetFilters(), otherIds);
        }

        Set<String> result = new LinkedHashSet<>();
        for (String[] pair : pairs) {
            if (matchingOthers.contains(pair[1])) {
                result.add(pair[0]);
            }
        }
        log.debug("Traversal {} {} -> {} matched {} of {} edges",
            traversal.getRelationTypeName(), traversal.getDirection(), targetType, result.size(), pairs.size());
        return result;
    }

    record Edge(String sourceType, String sourceId, String targetType, String targetId) {
    }
}
