package com.purchasingpower.hybridquery.store.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.hybridquery.core.ObjectInstance;
import com.purchasingpower.hybridquery.core.ObjectTypeDefinition;
import com.purchasingpower.hybridquery.core.PropertyDataType;
import com.purchasingpower.hybridquery.core.PropertyDefinition;
import com.purchasingpower.hybridquery.exception.StoreException;
import com.purchasingpower.hybridquery.query.RelationalFilter;
import com.purchasingpower.hybridquery.schema.SchemaRegistry;
import com.purchasingpower.hybridquery.store.RelationalStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Relational store on a JDBC data source, one table per object type.
 *
 * <p>Tables are named after the object type and carry {@code "id"},
 * {@code "weight"} and {@code "upsert_date"} columns next to one column per
 * declared property. Identifiers are always quoted. JSON properties are stored
 * as their serialized text. Upserts use the H2 {@code MERGE ... KEY} statement.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hybrid-query.store", name = "relational", havingValue = "jdbc")
public class JdbcRelationalStore implements RelationalStore {

    static final String ID_COLUMN = "id";
    static final String WEIGHT_COLUMN = "weight";
    static final String UPSERT_DATE_COLUMN = "upsert_date";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int MAX_IN_LIST = 1000;
    private static final String STORE = "relational";

    private final NamedParameterJdbcTemplate jdbc;
    private final SchemaRegistry schemaRegistry;
    private final Set<String> knownTables = ConcurrentHashMap.newKeySet();

    public JdbcRelationalStore(NamedParameterJdbcTemplate jdbc, SchemaRegistry schemaRegistry) {
        this.jdbc = jdbc;
        this.schemaRegistry = schemaRegistry;
        log.info("✅ JDBC relational store initialized");
    }

    /**
     * Create the table for an object type if it does not exist yet.
     */
    public void ensureTable(ObjectTypeDefinition definition) {
        if (knownTables.contains(definition.getName())) {
            return;
        }
        StringBuilder ddl = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
            .append(quote(definition.getName())).append(" (")
            .append(quote(ID_COLUMN)).append(" VARCHAR(255) PRIMARY KEY, ")
            .append(quote(WEIGHT_COLUMN)).append(" DOUBLE PRECISION, ")
            .append(quote(UPSERT_DATE_COLUMN)).append(" TIMESTAMP WITH TIME ZONE");
        for (PropertyDefinition property : definition.getProperties()) {
            if (isReservedColumn(property.getName())) {
                continue;
            }
            ddl.append(", ").append(quote(property.getName())).append(' ').append(sqlType(property.getDataType()));
        }
        ddl.append(')');

        try {
            jdbc.getJdbcOperations().execute(ddl.toString());
            knownTables.add(definition.getName());
            log.debug("Ensured table {}", definition.getName());
        } catch (DataAccessException e) {
            throw new StoreException(STORE, "Failed to create table for " + definition.getName()
                + ": " + e.getMessage(), e);
        }
    }

    /**
     * Insert or replace an object. The object type must be registered in the schema;
     * properties it does not declare are rejected.
     */
    public void upsert(ObjectInstance instance) {
        ObjectTypeDefinition definition = schemaRegistry.getObjectType(instance.getObjectTypeName())
            .orElseThrow(() -> new StoreException(STORE, "Unknown object type: " + instance.getObjectTypeName()));
        ensureTable(definition);

        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("p_id", instance.getId())
            .addValue("p_weight", instance.getWeight())
            .addValue("p_upsert_date", toBindValue(instance.getUpsertDate(), PropertyDataType.DATETIME));
        List<String> columns = new ArrayList<>(List.of(quote(ID_COLUMN), quote(WEIGHT_COLUMN), quote(UPSERT_DATE_COLUMN)));
        List<String> values = new ArrayList<>(List.of(":p_id", ":p_weight", ":p_upsert_date"));

        int index = 0;
        for (Map.Entry<String, Object> property : instance.getProperties().entrySet()) {
            PropertyDefinition declared = definition.findProperty(property.getKey())
                .orElseThrow(() -> new StoreException(STORE, "Property '" + property.getKey()
                    + "' is not declared on " + definition.getName()));
            String param = "v" + index++;
            columns.add(quote(declared.getName()));
            values.add(":" + param);
            params.addValue(param, toBindValue(property.getValue(), declared.getDataType()));
        }

        String sql = "MERGE INTO " + quote(definition.getName())
            + " (" + String.join(", ", columns) + ") KEY (" + quote(ID_COLUMN) + ")"
            + " VALUES (" + String.join(", ", values) + ")";
        try {
            jdbc.update(sql, params);
        } catch (DataAccessException e) {
            throw new StoreException(STORE, "Failed to upsert " + definition.getName() + " "
                + instance.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Set<String> filterIds(String objectTypeName, List<RelationalFilter> filters, Set<String> restrictTo) {
        if (restrictTo != null && restrictTo.isEmpty()) {
            return new LinkedHashSet<>();
        }
        ensureDeclaredTable(objectTypeName);
        SqlWhereBuilder where = new SqlWhereBuilder(propertyTypes(objectTypeName));
        filters.forEach(where::add);

        if (restrictTo == null) {
            return queryIds(objectTypeName, where.sql(), where.params());
        }
        Set<String> ids = new LinkedHashSet<>();
        for (List<String> chunk : chunks(restrictTo)) {
            MapSqlParameterSource params = where.params().addValue("restrict_ids", chunk);
            String sql = where.sql().isEmpty()
                ? quote(ID_COLUMN) + " IN (:restrict_ids)"
                : where.sql() + " AND " + quote(ID_COLUMN) + " IN (:restrict_ids)";
            ids.addAll(queryIds(objectTypeName, sql, params));
        }
        return ids;
    }

    @Override
    public Set<String> allIds(String objectTypeName) {
        ensureDeclaredTable(objectTypeName);
        return queryIds(objectTypeName, "", new MapSqlParameterSource());
    }

    @Override
    public List<ObjectInstance> getObjectsByIds(String objectTypeName, Collection<String> ids) {
        List<ObjectInstance> objects = new ArrayList<>();
        if (ids.isEmpty()) {
            return objects;
        }
        ensureDeclaredTable(objectTypeName);
        String sql = "SELECT * FROM " + quote(objectTypeName) + " WHERE " + quote(ID_COLUMN) + " IN (:ids)";
        try {
            for (List<String> chunk : chunks(ids)) {
                objects.addAll(jdbc.query(sql, new MapSqlParameterSource("ids", chunk),
                    (rs, rowNum) -> mapRow(objectTypeName, rs)));
            }
            return objects;
        } catch (DataAccessException e) {
            throw new StoreException(STORE, "Failed to load " + objectTypeName + " objects: " + e.getMessage(), e);
        }
    }

    /**
     * A type declared in the schema but never written to reads as empty, not as a missing table.
     */
    private void ensureDeclaredTable(String objectTypeName) {
        schemaRegistry.getObjectType(objectTypeName).ifPresent(this::ensureTable);
    }

    private Set<String> queryIds(String objectTypeName, String where, MapSqlParameterSource params) {
        String sql = "SELECT " + quote(ID_COLUMN) + " FROM " + quote(objectTypeName)
            + (where.isEmpty() ? "" : " WHERE " + where);
        log.trace("SQL: {}", sql);
        try {
            return new LinkedHashSet<>(jdbc.queryForList(sql, params, String.class));
        } catch (DataAccessException e) {
            throw new StoreException(STORE, "Failed to query " + objectTypeName + ": " + e.getMessage(), e);
        }
    }

    private ObjectInstance mapRow(String objectTypeName, ResultSet rs) throws SQLException {
        ObjectInstance.ObjectInstanceBuilder builder = ObjectInstance.builder().objectTypeName(objectTypeName);
        ResultSetMetaData meta = rs.getMetaData();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            String column = meta.getColumnLabel(i);
            Object value = rs.getObject(i);
            switch (column) {
                case ID_COLUMN -> builder.id(rs.getString(i));
                case WEIGHT_COLUMN -> builder.weight(rs.getDouble(i));
                case UPSERT_DATE_COLUMN -> {
                    if (value != null) {
                        builder.upsertDate(toInstant(value));
                    }
                }
                default -> {
                    if (value != null) {
                        builder.property(column, fromColumnValue(value));
                    }
                }
            }
        }
        return builder.build();
    }

    private Map<String, PropertyDataType> propertyTypes(String objectTypeName) {
        return schemaRegistry.getObjectType(objectTypeName)
            .map(definition -> definition.getProperties().stream()
                .collect(Collectors.toMap(PropertyDefinition::getName, PropertyDefinition::getDataType)))
            .orElse(Map.of());
    }

    static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    static String sqlType(PropertyDataType dataType) {
        return switch (dataType) {
            case TEXT, JSON -> "VARCHAR(4000)";
            case INTEGER -> "BIGINT";
            case FLOAT -> "DOUBLE PRECISION";
            case BOOLEAN -> "BOOLEAN";
            case DATETIME -> "TIMESTAMP WITH TIME ZONE";
            case BLOB -> "BLOB";
            case UUID -> "VARCHAR(36)";
        };
    }

    /**
     * Convert a filter or property value into something the JDBC driver binds
     * for a column of the given type.
     */
    static Object toBindValue(Object value, PropertyDataType dataType) {
        if (value == null) {
            return null;
        }
        if (dataType == PropertyDataType.DATETIME) {
            Object instant = value instanceof String text ? FilterMatcher.parseInstant(text) : value;
            if (instant instanceof Instant i) {
                return OffsetDateTime.ofInstant(i, ZoneOffset.UTC);
            }
            if (instant instanceof LocalDateTime local) {
                return local.atOffset(ZoneOffset.UTC);
            }
            if (instant instanceof ZonedDateTime zoned) {
                return zoned.toOffsetDateTime();
            }
            return instant;
        }
        if (dataType == PropertyDataType.JSON && !(value instanceof String)) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new StoreException(STORE, "Cannot serialize JSON value: " + e.getMessage(), e);
            }
        }
        if (value instanceof UUID uuid) {
            return uuid.toString();
        }
        if (dataType == PropertyDataType.UUID && value instanceof String text) {
            return text.toLowerCase();
        }
        return value;
    }

    private static Object fromColumnValue(Object value) {
        if (value instanceof OffsetDateTime || value instanceof Timestamp) {
            return toInstant(value);
        }
        return value;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toInstant();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        throw new StoreException(STORE, "Unsupported timestamp value: " + value.getClass().getName());
    }

    private static boolean isReservedColumn(String name) {
        return ID_COLUMN.equals(name) || WEIGHT_COLUMN.equals(name) || UPSERT_DATE_COLUMN.equals(name);
    }

    private static List<List<String>> chunks(Collection<String> ids) {
        List<List<String>> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>(Math.min(ids.size(), MAX_IN_LIST));
        for (String id : ids) {
            current.add(id);
            if (current.size() == MAX_IN_LIST) {
                chunks.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }
}
