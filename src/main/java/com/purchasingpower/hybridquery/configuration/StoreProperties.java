package com.purchasingpower.hybridquery.configuration;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Selects the adapter used for each store collaborator.
 */
@Data
public class StoreProperties {

    @NotNull
    private RelationalBackend relational = RelationalBackend.IN_MEMORY;

    @NotNull
    private VectorBackend vector = VectorBackend.IN_MEMORY;

    @NotNull
    private GraphBackend graph = GraphBackend.IN_MEMORY;

    @NotNull
    private EmbeddingProvider embedding = EmbeddingProvider.NONE;

    public enum RelationalBackend { IN_MEMORY, JDBC }

    public enum VectorBackend { IN_MEMORY, PINECONE }

    public enum GraphBackend { IN_MEMORY, NEO4J }

    public enum EmbeddingProvider { NONE, OLLAMA }
}
