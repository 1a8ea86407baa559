package com.purchasingpower.hybridquery.exception;

import lombok.Getter;

import java.util.List;

/**
 * Base of all engine failures. Carries every individual error message so callers
 * can report them all at once.
 *
 * @since 1.0.0
 */
@Getter
public class QueryEngineException extends RuntimeException {

    private final List<String> errors;

    public QueryEngineException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public QueryEngineException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public QueryEngineException(String summary, List<String> errors) {
        super(summary + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
