package com.purchasingpower.hybridquery.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Root of the {@code hybrid-query.*} configuration tree.
 *
 * <pre>
 * hybrid-query:
 *   executor:
 *     parallel-siblings: false
 *     timeout-ms: 30000
 *   schema:
 *     location: classpath:schema/schema.json
 *   store:
 *     relational: in-memory   # or jdbc
 *     vector: in-memory       # or pinecone
 *     graph: in-memory        # or neo4j
 *     embedding: none         # or ollama
 * </pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "hybrid-query")
public class QueryEngineProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ExecutorProperties executor = new ExecutorProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SchemaProperties schema = new SchemaProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private StoreProperties store = new StoreProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private PineconeProperties pinecone = new PineconeProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OllamaProperties ollama = new OllamaProperties();
}
