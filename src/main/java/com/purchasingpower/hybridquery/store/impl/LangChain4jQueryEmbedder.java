package com.purchasingpower.hybridquery.store.impl;

import com.purchasingpower.hybridquery.configuration.OllamaProperties;
import com.purchasingpower.hybridquery.configuration.QueryEngineProperties;
import com.purchasingpower.hybridquery.core.EmbeddingDefinition;
import com.purchasingpower.hybridquery.exception.StoreException;
import com.purchasingpower.hybridquery.store.QueryEmbedder;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Embeds query text with a LangChain4j embedding model served by Ollama.
 *
 * <p>The configured model should be the one that produced the stored vectors;
 * the definition's {@code embeddingModel} is only checked for a mismatch warning.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hybrid-query.store", name = "embedding", havingValue = "ollama")
public class LangChain4jQueryEmbedder implements QueryEmbedder {

    private final EmbeddingModel embeddingModel;
    private final String modelName;

    @Autowired
    public LangChain4jQueryEmbedder(QueryEngineProperties properties) {
        OllamaProperties ollama = properties.getOllama();
        log.info("🔷 Initializing Ollama query embedder");
        log.info("   - Ollama URL: {}", ollama.getBaseUrl());
        log.info("   - Model: {}", ollama.getEmbeddingModel());

        this.embeddingModel = OllamaEmbeddingModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getEmbeddingModel())
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .maxRetries(ollama.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
        this.modelName = ollama.getEmbeddingModel();
    }

    LangChain4jQueryEmbedder(EmbeddingModel embeddingModel, String modelName) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
    }

    @Override
    public List<Float> embed(EmbeddingDefinition definition, String text) {
        if (definition.getEmbeddingModel() != null && !definition.getEmbeddingModel().equals(modelName)) {
            log.warn("⚠️  Embedding definition '{}' declares model '{}' but queries are embedded with '{}'",
                definition.getName(), definition.getEmbeddingModel(), modelName);
        }

        Response<Embedding> response;
        try {
            response = embeddingModel.embed(text);
        } catch (Exception e) {
            throw new StoreException("embedding", "Failed to embed query text for '" + definition.getName()
                + "': " + e.getMessage(), e);
        }

        float[] vector = response.content().vector();
        if (definition.getDimensions() != null && vector.length != definition.getDimensions()) {
            throw new StoreException("embedding", "Model '" + modelName + "' produced " + vector.length
                + " dimensions, '" + definition.getName() + "' expects " + definition.getDimensions());
        }
        List<Float> result = new ArrayList<>(vector.length);
        for (float value : vector) {
            result.add(value);
        }
        return result;
    }
}
