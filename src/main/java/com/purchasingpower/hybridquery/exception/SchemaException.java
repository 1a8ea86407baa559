package com.purchasingpower.hybridquery.exception;

import java.util.List;

/**
 * A query references unknown schema elements or has an invalid tree shape.
 * Raised by the planner before any store is touched.
 */
public class SchemaException extends QueryEngineException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }

    public SchemaException(List<String> errors) {
        super("Query failed schema validation", errors);
    }
}
