package com.purchasingpower.hybridquery.store.impl;

import com.purchasingpower.hybridquery.core.PropertyDataType;
import com.purchasingpower.hybridquery.core.PropertyDefinition;
import com.purchasingpower.hybridquery.exception.StoreException;
import com.purchasingpower.hybridquery.query.GraphTraversalClause;
import com.purchasingpower.hybridquery.query.RelationalFilter;
import com.purchasingpower.hybridquery.query.TraversalDirection;
import com.purchasingpower.hybridquery.schema.SchemaRegistry;
import com.purchasingpower.hybridquery.store.GraphStore;
import com.purchasingpower.hybridquery.util.IsoDateTimes;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Neo4j implementation of {@link GraphStore}.
 *
 * <p>Object types map to node labels and relation types to relationship types.
 * Every node carries its object id in an {@code id} property. Queries are
 * parameterized; labels and property names are backtick-quoted. Target filter
 * values are bound according to the target property's declared type, so
 * ISO-8601 strings on DATETIME properties compare as date-times.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hybrid-query.store", name = "graph", havingValue = "neo4j")
public class Neo4jGraphStore implements GraphStore {

    private static final String STORE = "graph";

    private final Driver driver;
    private final SchemaRegistry schemaRegistry;

    public Neo4jGraphStore(Driver driver, SchemaRegistry schemaRegistry) {
        this.driver = driver;
        this.schemaRegistry = schemaRegistry;
        log.info("✅ Neo4j graph store initialized");
    }

    @Override
    public Set<String> filterByTraversal(String sourceObjectTypeName, GraphTraversalClause traversal,
                                         Set<String> restrictTo) {
        if (restrictTo != null && restrictTo.isEmpty()) {
            return new LinkedHashSet<>();
        }
        CypherQuery query = buildQuery(sourceObjectTypeName, traversal, restrictTo);
        log.trace("Cypher: {}", query.cypher());

        try (Session session = driver.session()) {
            List<String> ids = session.run(query.cypher(), query.parameters())
                .list(record -> record.get("id").asString());
            return new LinkedHashSet<>(ids);
        } catch (Neo4jException e) {
            throw new StoreException(STORE, "Traversal " + traversal.getRelationTypeName()
                + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Build the Cypher statement for one traversal.
     */
    CypherQuery buildQuery(String sourceObjectTypeName, GraphTraversalClause traversal, Set<String> restrictTo) {
        String relation = "[:" + quote(traversal.getRelationTypeName()) + "]";
        String pattern = traversal.getDirection() == TraversalDirection.INCOMING
            ? "(s:" + quote(sourceObjectTypeName) + ")<-" + relation + "-(t:" + quote(traversal.getTargetObjectTypeName()) + ")"
            : "(s:" + quote(sourceObjectTypeName) + ")-" + relation + "->(t:" + quote(traversal.getTargetObjectTypeName()) + ")";

        List<String> conditions = new ArrayList<>();
        Map<String, Object> parameters = new HashMap<>();
        if (restrictTo != null) {
            conditions.add("s.id IN $restrictTo");
            parameters.put("restrictTo", new ArrayList<>(restrictTo));
        }
        if (traversal.getTargetObjectId() != null) {
            conditions.add("t.id = $targetId");
            parameters.put("targetId", traversal.getTargetObjectId());
        }
        List<RelationalFilter> filters = traversal.getTargetFilters();
        for (int i = 0; i < filters.size(); i++) {
            RelationalFilter filter = filters.get(i);
            PropertyDataType type = propertyType(traversal.getTargetObjectTypeName(), filter.getPropertyName());
            conditions.add(condition(filter, type, "p" + i, parameters));
        }

        String cypher = "MATCH " + pattern
            + (conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions))
            + " RETURN DISTINCT s.id AS id";
        return new CypherQuery(cypher, parameters);
    }

    private PropertyDataType propertyType(String objectTypeName, String propertyName) {
        return schemaRegistry.getObjectType(objectTypeName)
            .flatMap(definition -> definition.findProperty(propertyName))
            .map(PropertyDefinition::getDataType)
            .orElse(PropertyDataType.TEXT);
    }

    private static String condition(RelationalFilter filter, PropertyDataType type, String param,
                                     Map<String, Object> parameters) {
        String property = "t." + quote(filter.getPropertyName());
        Object value = filter.getValue();
        if (value == null) {
            return switch (filter.getOperator()) {
                case EQ -> property + " IS NULL";
                case NE -> property + " IS NOT NULL";
                default -> "false";
            };
        }

        parameters.put(param, switch (filter.getOperator()) {
            case LIKE -> FilterMatcher.likePattern(value.toString()).pattern();
            case CONTAINS, STARTS_WITH, ENDS_WITH -> value.toString();
            default -> toParameter(value, type);
        });
        return switch (filter.getOperator()) {
            case EQ -> property + " = $" + param;
            case NE -> property + " <> $" + param;
            case GT -> property + " > $" + param;
            case GE -> property + " >= $" + param;
            case LT -> property + " < $" + param;
            case LE -> property + " <= $" + param;
            case IN -> property + " IN $" + param;
            case CONTAINS -> property + " CONTAINS $" + param;
            case STARTS_WITH -> property + " STARTS WITH $" + param;
            case ENDS_WITH -> property + " ENDS WITH $" + param;
            case LIKE -> property + " =~ $" + param;
        };
    }

    static Object toParameter(Object value, PropertyDataType type) {
        if (value instanceof Collection<?> values) {
            return values.stream().map(element -> toParameter(element, type)).collect(Collectors.toList());
        }
        if (type == PropertyDataType.DATETIME && value instanceof String text) {
            return IsoDateTimes.parse(text)
                .<Object>map(instant -> instant.atZone(ZoneOffset.UTC))
                .orElse(text);
        }
        if (type == PropertyDataType.DATETIME && value instanceof TemporalAccessor temporal) {
            return IsoDateTimes.toInstant(temporal)
                .<Object>map(instant -> instant.atZone(ZoneOffset.UTC))
                .orElse(value);
        }
        if (value instanceof UUID uuid) {
            return uuid.toString();
        }
        if (value instanceof Instant instant) {
            return instant.atZone(ZoneOffset.UTC);
        }
        if (type == PropertyDataType.UUID && value instanceof String text) {
            return text.toLowerCase();
        }
        return value;
    }

    static String quote(String name) {
        return "`" + name.replace("`", "``") + "`";
    }

    record CypherQuery(String cypher, Map<String, Object> parameters) {
    }
}
