package com.purchasingpower.hybridquery.planner;

import com.purchasingpower.hybridquery.core.EmbeddingDefinition;
import com.purchasingpower.hybridquery.query.EmbeddingSearchClause;
import lombok.Getter;
import lombok.ToString;

/**
 * One nearest-neighbour search, with its embedding definition already resolved.
 */
@Getter
@ToString
public class EmbeddingSearchStep extends PlannedStep {

    private final EmbeddingSearchClause search;
    private final EmbeddingDefinition definition;

    public EmbeddingSearchStep(String objectTypeName, EmbeddingSearchClause search, EmbeddingDefinition definition) {
        super(StepKind.EMBEDDING_SEARCH, objectTypeName);
        this.search = search;
        this.definition = definition;
    }
}
