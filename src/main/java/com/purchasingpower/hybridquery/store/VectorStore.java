package com.purchasingpower.hybridquery.store;

import java.util.Set;

/**
 * Vector collaborator: nearest-neighbour search over one embedding definition.
 *
 * @since 1.0.0
 */
public interface VectorStore {

    /**
     * Ids of the top {@code limit} objects closest to the request vector.
     *
     * <p>When the request carries a candidate set, ranking happens among those
     * candidates only, so the result is always a subset of it.
     */
    Set<String> searchIds(VectorSearchRequest request);
}
