package com.purchasingpower.hybridquery.exception;

/**
 * Generic top-level failure, e.g. a query without a root clause.
 */
public class QueryException extends QueryEngineException {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
