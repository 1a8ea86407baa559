package com.purchasingpower.hybridquery.store;

import com.purchasingpower.hybridquery.core.EmbeddingDefinition;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Resolved vector search handed to a {@link VectorStore}.
 *
 * <p>{@code threshold} is optional. With {@code l2Distance} it is a maximum
 * distance, otherwise a minimum cosine similarity.
 */
@Value
@Builder
public class VectorSearchRequest {

    EmbeddingDefinition definition;
    List<Float> vector;
    int limit;
    Double threshold;
    boolean l2Distance;
    Set<String> restrictTo;

    public String getObjectTypeName() {
        return definition.getObjectTypeName();
    }
}
