package com.purchasingpower.hybridquery.query;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Condition on one property of an object.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class RelationalFilter {

    String propertyName;
    RelationalOperator operator;
    Object value;

    public static RelationalFilter of(String propertyName, RelationalOperator operator, Object value) {
        return new RelationalFilter(propertyName, operator, value);
    }

    @Override
    public String toString() {
        return propertyName + " " + operator + " " + value;
    }
}
