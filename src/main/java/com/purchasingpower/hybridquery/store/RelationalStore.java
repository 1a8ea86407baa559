package com.purchasingpower.hybridquery.store;

import com.purchasingpower.hybridquery.core.ObjectInstance;
import com.purchasingpower.hybridquery.query.RelationalFilter;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Relational collaborator: property filters and object hydration.
 *
 * <p>Every id-returning method takes an optional candidate set. {@code null}
 * means unconstrained; an empty set means nothing can match.
 *
 * @since 1.0.0
 */
public interface RelationalStore {

    /**
     * Ids of objects of {@code objectTypeName} that satisfy all filters (ANDed).
     *
     * @param objectTypeName object type to search
     * @param filters filters to apply, never empty
     * @param restrictTo candidate ids, or {@code null} for the whole type
     * @return matching ids, a subset of {@code restrictTo} when it is set
     */
    Set<String> filterIds(String objectTypeName, List<RelationalFilter> filters, Set<String> restrictTo);

    /**
     * Every id of the given object type. Used for negation and for components
     * without conditions.
     */
    Set<String> allIds(String objectTypeName);

    /**
     * Hydrate objects by id. Unknown ids are skipped.
     */
    List<ObjectInstance> getObjectsByIds(String objectTypeName, Collection<String> ids);
}
