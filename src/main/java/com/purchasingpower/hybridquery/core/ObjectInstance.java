package com.purchasingpower.hybridquery.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Concrete object returned by a query.
 *
 * <p>{@code weight} is a caller-assigned relevance weight in [0, 10].
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ObjectInstance {

    public static final double MIN_WEIGHT = 0.0;
    public static final double MAX_WEIGHT = 10.0;

    String id;
    String objectTypeName;

    @Builder.Default
    double weight = 1.0;

    @Builder.Default
    Instant upsertDate = Instant.now();

    @Singular("property")
    Map<String, Object> properties;

    public Object getProperty(String name) {
        return properties.get(name);
    }
}
