package com.purchasingpower.hybridquery.store.impl;

import com.purchasingpower.hybridquery.core.ObjectInstance;
import com.purchasingpower.hybridquery.query.RelationalFilter;
import com.purchasingpower.hybridquery.store.RelationalStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Relational store held in memory, one concurrent map per object type.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hybrid-query.store", name = "relational", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryRelationalStore implements RelationalStore {

    private final Map<String, Map<String, ObjectInstance>> objectsByType = new ConcurrentHashMap<>();

    /**
     * Insert or replace an object, keyed by type and id.
     */
    public void upsert(ObjectInstance instance) {
        Objects.requireNonNull(instance.getId(), "Object id is required");
        Objects.requireNonNull(instance.getObjectTypeName(), "Object type is required");
        objectsByType.computeIfAbsent(instance.getObjectTypeName(), t -> new ConcurrentHashMap<>())
            .put(instance.getId(), instance);
        log.trace("Upserted {} {}", instance.getObjectTypeName(), instance.getId());
    }

    public void upsertAll(Collection<ObjectInstance> instances) {
        instances.forEach(this::upsert);
    }

    public boolean delete(String objectTypeName, String id) {
        Map<String, ObjectInstance> objects = objectsByType.get(objectTypeName);
        return objects != null && objects.remove(id) != null;
    }

    public void clear() {
        objectsByType.clear();
    }

    @Override
    public Set<String> filterIds(String objectTypeName, List<RelationalFilter> filters, Set<String> restrictTo) {
        return candidates(objectTypeName, restrictTo).stream()
            .filter(o -> FilterMatcher.matchesAll(o.getProperties(), filters))
            .map(ObjectInstance::getId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public Set<String> allIds(String objectTypeName) {
        return new LinkedHashSet<>(objectsOf(objectTypeName).keySet());
    }

    @Override
    public List<ObjectInstance> getObjectsByIds(String objectTypeName, Collection<String> ids) {
        Map<String, ObjectInstance> objects = objectsOf(objectTypeName);
        List<ObjectInstance> found = new ArrayList<>(ids.size());
        for (String id : ids) {
            ObjectInstance instance = objects.get(id);
            if (instance != null) {
                found.add(instance);
            }
        }
        return found;
    }

    private Collection<ObjectInstance> candidates(String objectTypeName, Set<String> restrictTo) {
        Map<String, ObjectInstance> objects = objectsOf(objectTypeName);
        if (restrictTo == null) {
            return objects.values();
        }
        return restrictTo.stream()
            .map(objects::get)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    private Map<String, ObjectInstance> objectsOf(String objectTypeName) {
        return objectsByType.getOrDefault(objectTypeName, Map.of());
    }
}
