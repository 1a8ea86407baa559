package com.purchasingpower.hybridquery.exception;

import java.util.List;

/**
 * A filter value or search parameter does not fit its declared type or operator.
 */
public class ValidationException extends QueryEngineException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(List<String> errors) {
        super("Query failed value validation", errors);
    }
}
