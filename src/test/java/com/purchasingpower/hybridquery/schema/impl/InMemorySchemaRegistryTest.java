package com.purchasingpower.hybridquery.schema.impl;

import com.purchasingpower.hybridquery.core.ObjectTypeDefinition;
import com.purchasingpower.hybridquery.core.PropertyDataType;
import com.purchasingpower.hybridquery.core.PropertyDefinition;
import com.purchasingpower.hybridquery.schema.SchemaDocument;
import com.purchasingpower.hybridquery.support.TestSchemas;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySchemaRegistryTest {

    @Test
    void looksUpByExactName() {
        InMemorySchemaRegistry registry = TestSchemas.registry();

        assertThat(registry.getObjectType("Car")).isPresent();
        assertThat(registry.getObjectType("car")).isEmpty();
        assertThat(registry.getObjectType(null)).isEmpty();
        assertThat(registry.getRelationType(TestSchemas.LOCATED_IN)).isPresent();
        assertThat(registry.getEmbeddingDefinition(TestSchemas.CAR_DESCRIPTION)).isPresent();
    }

    @Test
    void reRegisteringReplacesDefinition() {
        InMemorySchemaRegistry registry = TestSchemas.registry();

        registry.register(ObjectTypeDefinition.builder()
            .name("City")
            .property(PropertyDefinition.of("population", PropertyDataType.INTEGER))
            .build());

        assertThat(registry.getObjectType("City")).hasValueSatisfying(city -> {
            assertThat(city.findProperty("population")).isPresent();
            assertThat(city.findProperty("name")).isEmpty();
        });
        assertThat(registry.listObjectTypes()).hasSize(3);
    }

    @Test
    void registersWholeDocument() {
        InMemorySchemaRegistry registry = new InMemorySchemaRegistry();

        registry.registerAll(SchemaDocument.builder()
            .objectTypes(List.of(ObjectTypeDefinition.builder().name("Author").build()))
            .embeddingDefinitions(List.of(TestSchemas.carDescription()))
            .build());

        assertThat(registry.listObjectTypes()).extracting(ObjectTypeDefinition::getName).containsExactly("Author");
        assertThat(registry.listRelationTypes()).isEmpty();
        assertThat(registry.listEmbeddingDefinitions()).hasSize(1);
    }
}
