package com.purchasingpower.hybridquery.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.hybridquery.configuration.QueryEngineProperties;
import com.purchasingpower.hybridquery.configuration.SchemaProperties;
import com.purchasingpower.hybridquery.exception.SchemaException;
import com.purchasingpower.hybridquery.schema.impl.InMemorySchemaRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the schema snapshot configured under {@code hybrid-query.schema} into the
 * in-memory registry at startup.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaLoader {

    private final QueryEngineProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final InMemorySchemaRegistry registry;

    @PostConstruct
    public void loadConfiguredSchema() {
        SchemaProperties schema = properties.getSchema();
        if (schema.getLocation() == null || schema.getLocation().isBlank()) {
            log.info("No schema location configured, starting with an empty schema");
            return;
        }

        Resource resource = resourceLoader.getResource(schema.getLocation());
        if (!resource.exists()) {
            if (schema.isFailOnMissing()) {
                throw new SchemaException("Schema document not found: " + schema.getLocation());
            }
            log.warn("⚠️  Schema document {} not found, starting with an empty schema", schema.getLocation());
            return;
        }

        SchemaDocument document = read(resource);
        registry.registerAll(document);
        log.info("✅ Loaded schema from {}: {} object types, {} relation types, {} embedding definitions",
            schema.getLocation(),
            document.getObjectTypes().size(),
            document.getRelationTypes().size(),
            document.getEmbeddingDefinitions().size());
    }

    /**
     * Parse a schema document.
     *
     * @param resource JSON resource
     * @return parsed document
     * @throws SchemaException if the resource cannot be read or parsed
     */
    public SchemaDocument read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, SchemaDocument.class);
        } catch (IOException e) {
            throw new SchemaException("Failed to read schema document " + resource.getDescription()
                + ": " + e.getMessage(), e);
        }
    }
}
