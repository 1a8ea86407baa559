package com.purchasingpower.hybridquery.support;

import com.purchasingpower.hybridquery.core.EmbeddingDefinition;
import com.purchasingpower.hybridquery.core.ObjectInstance;
import com.purchasingpower.hybridquery.core.ObjectTypeDefinition;
import com.purchasingpower.hybridquery.core.PropertyDataType;
import com.purchasingpower.hybridquery.core.PropertyDefinition;
import com.purchasingpower.hybridquery.core.RelationTypeDefinition;
import com.purchasingpower.hybridquery.schema.impl.InMemorySchemaRegistry;

import java.util.Map;

/**
 * Schema and objects shared by the engine tests.
 *
 * <ul>
 *   <li>Car (color, year, price, registered, vin, specs, photo), City (name), User (name, department)</li>
 *   <li>LocatedIn: Car -> City</li>
 *   <li>car_description: 3-dimensional embedding on Car</li>
 * </ul>
 */
public final class TestSchemas {

    public static final String CAR = "Car";
    public static final String CITY = "City";
    public static final String USER = "User";
    public static final String LOCATED_IN = "LocatedIn";
    public static final String CAR_DESCRIPTION = "car_description";

    private TestSchemas() {
    }

    public static InMemorySchemaRegistry registry() {
        return new InMemorySchemaRegistry()
            .register(ObjectTypeDefinition.builder()
                .name(CAR)
                .property(PropertyDefinition.of("color", PropertyDataType.TEXT))
                .property(PropertyDefinition.of("year", PropertyDataType.INTEGER))
                .property(PropertyDefinition.of("price", PropertyDataType.FLOAT))
                .property(PropertyDefinition.of("registered", PropertyDataType.DATETIME))
                .property(PropertyDefinition.of("electric", PropertyDataType.BOOLEAN))
                .property(PropertyDefinition.of("vin", PropertyDataType.UUID))
                .property(PropertyDefinition.of("specs", PropertyDataType.JSON))
                .property(PropertyDefinition.of("photo", PropertyDataType.BLOB))
                .build())
            .register(ObjectTypeDefinition.builder()
                .name(CITY)
                .property(PropertyDefinition.of("name", PropertyDataType.TEXT))
                .build())
            .register(ObjectTypeDefinition.builder()
                .name(USER)
                .property(PropertyDefinition.of("name", PropertyDataType.TEXT))
                .property(PropertyDefinition.of("department", PropertyDataType.TEXT))
                .build())
            .register(RelationTypeDefinition.builder()
                .name(LOCATED_IN)
                .sourceObjectTypeName(CAR)
                .targetObjectTypeName(CITY)
                .build())
            .register(carDescription());
    }

    public static EmbeddingDefinition carDescription() {
        return EmbeddingDefinition.builder()
            .name(CAR_DESCRIPTION)
            .objectTypeName(CAR)
            .sourcePropertyName("color")
            .embeddingModel("test-model")
            .dimensions(3)
            .build();
    }

    public static ObjectInstance object(String type, String id, Map<String, Object> properties) {
        return ObjectInstance.builder()
            .id(id)
            .objectTypeName(type)
            .properties(properties)
            .build();
    }
}
