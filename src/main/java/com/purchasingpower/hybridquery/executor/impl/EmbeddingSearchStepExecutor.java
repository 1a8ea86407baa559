package com.purchasingpower.hybridquery.executor.impl;

import com.purchasingpower.hybridquery.core.EmbeddingDefinition;
import com.purchasingpower.hybridquery.exception.StoreException;
import com.purchasingpower.hybridquery.executor.StepExecutor;
import com.purchasingpower.hybridquery.model.CallContext;
import com.purchasingpower.hybridquery.model.ServiceType;
import com.purchasingpower.hybridquery.planner.EmbeddingSearchStep;
import com.purchasingpower.hybridquery.planner.StepKind;
import com.purchasingpower.hybridquery.query.EmbeddingSearchClause;
import com.purchasingpower.hybridquery.store.QueryEmbedder;
import com.purchasingpower.hybridquery.store.VectorSearchRequest;
import com.purchasingpower.hybridquery.store.VectorStore;
import com.purchasingpower.hybridquery.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Runs embedding searches. Query text is embedded on the fly when a
 * {@link QueryEmbedder} is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmbeddingSearchStepExecutor implements StepExecutor<EmbeddingSearchStep> {

    private final VectorStore vectorStore;
    private final ObjectProvider<QueryEmbedder> queryEmbedder;

    @Override
    public StepKind kind() {
        return StepKind.EMBEDDING_SEARCH;
    }

    @Override
    public Class<EmbeddingSearchStep> stepType() {
        return EmbeddingSearchStep.class;
    }

    @Override
    public Set<String> execute(EmbeddingSearchStep step, Set<String> restrictTo) {
        EmbeddingSearchClause search = step.getSearch();
        VectorSearchRequest request = VectorSearchRequest.builder()
            .definition(step.getDefinition())
            .vector(resolveVector(step.getDefinition(), search))
            .limit(search.getLimit())
            .threshold(search.getThreshold())
            .l2Distance(search.isL2Distance())
            .restrictTo(restrictTo)
            .build();

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.VECTOR, "searchIds", log);
        ctx.logRequest(step.getDefinition().getName() + " top " + search.getLimit(),
            "threshold", search.getThreshold(),
            "l2Distance", search.isL2Distance(),
            "restrictTo", ExternalCallLogger.formatIds(restrictTo));
        try {
            Set<String> ids = vectorStore.searchIds(request);
            ctx.logResponse(ids.size());
            return ids;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }

    private List<Float> resolveVector(EmbeddingDefinition definition, EmbeddingSearchClause search) {
        if (search.hasQueryVector()) {
            return search.getQueryVector();
        }
        QueryEmbedder embedder = queryEmbedder.getIfAvailable();
        if (embedder == null) {
            throw new StoreException("embedding", "No query embedder configured to embed query text for '"
                + definition.getName() + "'");
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.EMBEDDING, "embed", log);
        ctx.logRequest(ExternalCallLogger.truncate(search.getQueryText(), 80));
        try {
            List<Float> vector = embedder.embed(definition, search.getQueryText());
            ctx.logResponse(vector.size());
            return vector;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }
}
