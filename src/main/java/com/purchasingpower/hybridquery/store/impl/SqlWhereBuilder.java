package com.purchasingpower.hybridquery.store.impl;

import com.purchasingpower.hybridquery.core.PropertyDataType;
import com.purchasingpower.hybridquery.query.RelationalFilter;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders relational filters as a parameterized SQL {@code WHERE} body.
 * Property names are quoted and values are always bound, never inlined.
 * Patterns are escaped with a backslash, so in LIKE patterns a backslash is a
 * literal and only {@code %} and {@code _} are wildcards.
 */
class SqlWhereBuilder {

    private static final char LIKE_ESCAPE = '\\';

    private final Map<String, PropertyDataType> propertyTypes;
    private final List<String> conditions = new ArrayList<>();
    private final Map<String, Object> values = new LinkedHashMap<>();

    SqlWhereBuilder(Map<String, PropertyDataType> propertyTypes) {
        this.propertyTypes = propertyTypes;
    }

    SqlWhereBuilder add(RelationalFilter filter) {
        String column = JdbcRelationalStore.quote(filter.getPropertyName());
        String param = "f" + conditions.size();
        PropertyDataType type = propertyTypes.getOrDefault(filter.getPropertyName(), PropertyDataType.TEXT);
        Object value = filter.getValue();

        if (value == null) {
            conditions.add(switch (filter.getOperator()) {
                case EQ -> column + " IS NULL";
                case NE -> column + " IS NOT NULL";
                default -> "1 = 0";
            });
            return this;
        }

        String condition = switch (filter.getOperator()) {
            case EQ -> column + " = :" + param;
            case NE -> column + " <> :" + param;
            case GT -> column + " > :" + param;
            case GE -> column + " >= :" + param;
            case LT -> column + " < :" + param;
            case LE -> column + " <= :" + param;
            case IN -> column + " IN (:" + param + ")";
            case LIKE, CONTAINS, STARTS_WITH, ENDS_WITH -> column + " LIKE :" + param + " ESCAPE '" + LIKE_ESCAPE + "'";
        };
        Object bound = switch (filter.getOperator()) {
            case CONTAINS -> "%" + escapeLike(value.toString()) + "%";
            case STARTS_WITH -> escapeLike(value.toString()) + "%";
            case ENDS_WITH -> "%" + escapeLike(value.toString());
            case LIKE -> value.toString().replace(String.valueOf(LIKE_ESCAPE), "" + LIKE_ESCAPE + LIKE_ESCAPE);
            case IN -> ((Collection<?>) value).stream()
                .map(element -> JdbcRelationalStore.toBindValue(element, type))
                .collect(Collectors.toList());
            default -> JdbcRelationalStore.toBindValue(value, type);
        };
        conditions.add(condition);
        values.put(param, bound);
        return this;
    }

    String sql() {
        return String.join(" AND ", conditions);
    }

    MapSqlParameterSource params() {
        return new MapSqlParameterSource(values);
    }

    static String escapeLike(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
