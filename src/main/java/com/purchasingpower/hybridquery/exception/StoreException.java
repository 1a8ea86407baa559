package com.purchasingpower.hybridquery.exception;

import lombok.Getter;

/**
 * A store collaborator call failed.
 *
 * <p>The executor catches these per branch and records them in the result; they
 * never escape {@code execute}.
 */
@Getter
public class StoreException extends QueryEngineException {

    private final String store;

    public StoreException(String store, String message) {
        super(message);
        this.store = store;
    }

    public StoreException(String store, String message, Throwable cause) {
        super(message, cause);
        this.store = store;
    }
}
