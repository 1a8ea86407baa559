package com.purchasingpower.hybridquery.store.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.hybridquery.exception.StoreException;
import com.purchasingpower.hybridquery.query.RelationalFilter;
import com.purchasingpower.hybridquery.query.RelationalOperator;
import com.purchasingpower.hybridquery.util.IsoDateTimes;

import java.math.BigDecimal;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Evaluates relational filters against in-memory property maps.
 *
 * <p>Follows SQL semantics for missing values: a {@code null} property only
 * matches {@code == null}, and fails every other comparison including {@code !=}.
 * Numbers compare by value regardless of boxed type; date-times compare as
 * instants, with ISO-8601 strings accepted on either side. Pattern operators see
 * structured JSON values as their JSON text.
 */
public final class FilterMatcher {

    private static final ObjectMapper JSON = new ObjectMapper();

    private FilterMatcher() {
    }

    public static boolean matchesAll(Map<String, Object> properties, Collection<RelationalFilter> filters) {
        for (RelationalFilter filter : filters) {
            if (!matches(properties.get(filter.getPropertyName()), filter.getOperator(), filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    public static boolean matches(Object actual, RelationalOperator operator, Object expected) {
        if (expected == null) {
            return switch (operator) {
                case EQ -> actual == null;
                case NE -> actual != null;
                default -> false;
            };
        }
        if (actual == null) {
            return false;
        }

        return switch (operator) {
            case EQ -> valueEquals(actual, expected);
            case NE -> !valueEquals(actual, expected);
            case GT -> compare(actual, expected).map(c -> c > 0).orElse(false);
            case GE -> compare(actual, expected).map(c -> c >= 0).orElse(false);
            case LT -> compare(actual, expected).map(c -> c < 0).orElse(false);
            case LE -> compare(actual, expected).map(c -> c <= 0).orElse(false);
            case CONTAINS -> patternText(actual).contains(expected.toString());
            case STARTS_WITH -> patternText(actual).startsWith(expected.toString());
            case ENDS_WITH -> patternText(actual).endsWith(expected.toString());
            case LIKE -> likePattern(expected.toString()).matcher(patternText(actual)).matches();
            case IN -> expected instanceof Collection<?> options
                && options.stream().anyMatch(option -> option != null && valueEquals(actual, option));
        };
    }

    /**
     * Text a pattern operator runs against. Structured JSON values (maps, lists)
     * are serialized the way the JDBC store writes them to their column.
     */
    static String patternText(Object actual) {
        if (actual instanceof Map<?, ?> || actual instanceof Collection<?>) {
            try {
                return JSON.writeValueAsString(actual);
            } catch (JsonProcessingException e) {
                throw new StoreException("relational", "Cannot serialize JSON value: " + e.getMessage(), e);
            }
        }
        return actual.toString();
    }

    static boolean valueEquals(Object actual, Object expected) {
        Object left = normalize(actual, expected);
        Object right = normalize(expected, actual);
        if (left instanceof BigDecimal a && right instanceof BigDecimal b) {
            return a.compareTo(b) == 0;
        }
        return Objects.equals(left, right);
    }

    /**
     * Compare two values of an ordered type.
     *
     * @return sign of the comparison, or empty when the values cannot be ordered
     *         against each other
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static Optional<Integer> compare(Object actual, Object expected) {
        Object left = normalize(actual, expected);
        Object right = normalize(expected, actual);
        if (left instanceof Comparable && left.getClass().equals(right.getClass())) {
            return Optional.of(Integer.signum(((Comparable) left).compareTo(right)));
        }
        return Optional.empty();
    }

    /**
     * Translate a SQL LIKE pattern ({@code %} any run, {@code _} one character)
     * into an anchored regex.
     */
    static Pattern likePattern(String like) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : like.toCharArray()) {
            if (c == '%' || c == '_') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static Object normalize(Object value, Object other) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : d;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof TemporalAccessor temporal) {
            return IsoDateTimes.toInstant(temporal).<Object>map(i -> i).orElse(value);
        }
        if (value instanceof UUID uuid) {
            return uuid.toString();
        }
        if (value instanceof String text) {
            if (other instanceof TemporalAccessor) {
                return parseInstant(text);
            }
            if (other instanceof UUID) {
                return text.toLowerCase();
            }
        }
        return value;
    }

    /**
     * ISO-8601 text as an instant; unparseable text is returned as is and
     * compares unequal to any instant.
     */
    static Object parseInstant(String text) {
        return IsoDateTimes.parse(text).<Object>map(i -> i).orElse(text);
    }
}
