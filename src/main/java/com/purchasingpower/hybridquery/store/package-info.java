/**
 * Store collaborator interfaces the executor runs plan steps against.
 *
 * <ul>
 *   <li>{@link com.purchasingpower.hybridquery.store.RelationalStore} - property filters, extents, hydration</li>
 *   <li>{@link com.purchasingpower.hybridquery.store.VectorStore} - nearest-neighbour search</li>
 *   <li>{@link com.purchasingpower.hybridquery.store.GraphStore} - relationship traversal</li>
 *   <li>{@link com.purchasingpower.hybridquery.store.QueryEmbedder} - query text to vector</li>
 * </ul>
 *
 * <p>Adapters live in {@code store.impl} and are selected by {@code hybrid-query.store.*}.
 */
package com.purchasingpower.hybridquery.store;
