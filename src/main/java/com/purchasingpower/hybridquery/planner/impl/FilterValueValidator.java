package com.purchasingpower.hybridquery.planner.impl;

import com.purchasingpower.hybridquery.core.PropertyDataType;
import com.purchasingpower.hybridquery.core.PropertyDefinition;
import com.purchasingpower.hybridquery.query.RelationalOperator;
import com.purchasingpower.hybridquery.util.IsoDateTimes;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Operator and value checks for a single relational filter.
 *
 * <p>Operator problems are schema problems; value problems are validation problems.
 * Both are returned as messages and never thrown, so the planner can report every
 * problem of a query at once.
 */
final class FilterValueValidator {

    private FilterValueValidator() {
    }

    /**
     * @return a message when the operator cannot be applied to the property's type
     */
    static Optional<String> checkOperator(String qualifiedName, PropertyDefinition property,
                                          RelationalOperator operator) {
        PropertyDataType type = property.getDataType();
        boolean supported;
        if (operator.isOrdering()) {
            supported = type.isOrdered();
        } else if (operator.isPattern()) {
            supported = type.isTextLike();
        } else {
            supported = type.isComparable();
        }
        if (supported) {
            return Optional.empty();
        }
        return Optional.of("Operator '" + operator + "' is not supported for " + type
            + " property '" + qualifiedName + "'");
    }

    /**
     * @return a message when the value does not fit the operator or property type
     */
    static Optional<String> checkValue(String qualifiedName, PropertyDefinition property,
                                       RelationalOperator operator, Object value) {
        if (value == null) {
            if (operator == RelationalOperator.EQ || operator == RelationalOperator.NE) {
                return Optional.empty();
            }
            return Optional.of("Operator '" + operator + "' does not accept null for '" + qualifiedName + "'");
        }

        if (operator.isPattern()) {
            return value instanceof String
                ? Optional.empty()
                : Optional.of("Operator '" + operator + "' requires a string pattern for '" + qualifiedName
                    + "', got " + describe(value));
        }

        if (operator == RelationalOperator.IN) {
            if (!(value instanceof Collection<?> values)) {
                return Optional.of("Operator 'IN' requires a list of values for '" + qualifiedName
                    + "', got " + describe(value));
            }
            if (values.isEmpty()) {
                return Optional.of("Operator 'IN' requires a non-empty list for '" + qualifiedName + "'");
            }
            for (Object element : values) {
                if (element == null || !fitsType(property.getDataType(), element)) {
                    return Optional.of("Value " + describe(element) + " in IN list is not a valid "
                        + property.getDataType() + " for '" + qualifiedName + "'");
                }
            }
            return Optional.empty();
        }

        if (!fitsType(property.getDataType(), value)) {
            return Optional.of("Value " + describe(value) + " is not a valid " + property.getDataType()
                + " for '" + qualifiedName + "'");
        }
        return Optional.empty();
    }

    static boolean fitsType(PropertyDataType type, Object value) {
        return switch (type) {
            case TEXT -> value instanceof String;
            case INTEGER -> isIntegral(value);
            case FLOAT -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case DATETIME -> value instanceof TemporalAccessor temporal
                ? IsoDateTimes.toInstant(temporal).isPresent()
                : value instanceof String text && IsoDateTimes.parse(text).isPresent();
            case UUID -> value instanceof UUID || value instanceof String text && isUuid(text);
            case JSON -> true;
            case BLOB -> value instanceof byte[];
        };
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private static boolean isUuid(String text) {
        try {
            UUID.fromString(text);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "'" + value + "' (string)";
        }
        return value + " (" + value.getClass().getSimpleName() + ")";
    }
}
