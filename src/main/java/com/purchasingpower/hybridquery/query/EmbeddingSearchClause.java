package com.purchasingpower.hybridquery.query;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Nearest-neighbour search against one embedding definition.
 *
 * <p>Exactly one of {@code queryVector} and {@code queryText} is expected. Text is
 * turned into a vector at execution time by the configured query embedder.
 * When {@code l2Distance} is set, {@code threshold} is a maximum L2 distance;
 * otherwise it is a minimum cosine similarity.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class EmbeddingSearchClause {

    public static final int DEFAULT_LIMIT = 10;

    String embeddingDefinitionName;
    List<Float> queryVector;
    String queryText;

    @Builder.Default
    int limit = DEFAULT_LIMIT;

    Double threshold;

    @Builder.Default
    boolean l2Distance = false;

    public boolean hasQueryVector() {
        return queryVector != null && !queryVector.isEmpty();
    }

    public boolean hasQueryText() {
        return queryText != null && !queryText.isBlank();
    }
}
