package com.purchasingpower.hybridquery.store;

import com.purchasingpower.hybridquery.core.EmbeddingDefinition;

import java.util.List;

/**
 * Turns query text into a vector compatible with an embedding definition.
 * Optional: without one, embedding searches must carry a query vector.
 *
 * @since 1.0.0
 */
public interface QueryEmbedder {

    List<Float> embed(EmbeddingDefinition definition, String text);
}
