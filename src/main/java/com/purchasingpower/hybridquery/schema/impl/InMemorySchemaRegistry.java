package com.purchasingpower.hybridquery.schema.impl;

import com.purchasingpower.hybridquery.core.EmbeddingDefinition;
import com.purchasingpower.hybridquery.core.ObjectTypeDefinition;
import com.purchasingpower.hybridquery.core.RelationTypeDefinition;
import com.purchasingpower.hybridquery.schema.SchemaDocument;
import com.purchasingpower.hybridquery.schema.SchemaRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe schema registry backed by concurrent maps.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class InMemorySchemaRegistry implements SchemaRegistry {

    private final Map<String, ObjectTypeDefinition> objectTypes = new ConcurrentHashMap<>();
    private final Map<String, RelationTypeDefinition> relationTypes = new ConcurrentHashMap<>();
    private final Map<String, EmbeddingDefinition> embeddingDefinitions = new ConcurrentHashMap<>();

    public InMemorySchemaRegistry register(ObjectTypeDefinition definition) {
        objectTypes.put(definition.getName(), definition);
        log.debug("Registered object type {}", definition.getName());
        return this;
    }

    public InMemorySchemaRegistry register(RelationTypeDefinition definition) {
        relationTypes.put(definition.getName(), definition);
        log.debug("Registered relation type {}", definition.getName());
        return this;
    }

    public InMemorySchemaRegistry register(EmbeddingDefinition definition) {
        embeddingDefinitions.put(definition.getName(), definition);
        log.debug("Registered embedding definition {}", definition.getName());
        return this;
    }

    public void registerAll(SchemaDocument document) {
        document.getObjectTypes().forEach(this::register);
        document.getRelationTypes().forEach(this::register);
        document.getEmbeddingDefinitions().forEach(this::register);
    }

    @Override
    public Optional<ObjectTypeDefinition> getObjectType(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(objectTypes.get(name));
    }

    @Override
    public Optional<RelationTypeDefinition> getRelationType(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(relationTypes.get(name));
    }

    @Override
    public Optional<EmbeddingDefinition> getEmbeddingDefinition(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(embeddingDefinitions.get(name));
    }

    @Override
    public List<ObjectTypeDefinition> listObjectTypes() {
        return new ArrayList<>(objectTypes.values());
    }

    @Override
    public List<RelationTypeDefinition> listRelationTypes() {
        return new ArrayList<>(relationTypes.values());
    }

    @Override
    public List<EmbeddingDefinition> listEmbeddingDefinitions() {
        return new ArrayList<>(embeddingDefinitions.values());
    }
}
