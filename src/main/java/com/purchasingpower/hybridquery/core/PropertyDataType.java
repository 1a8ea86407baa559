package com.purchasingpower.hybridquery.core;

/**
 * Data types a property may declare.
 *
 * @since 1.0.0
 */
public enum PropertyDataType {
    TEXT,
    INTEGER,
    FLOAT,
    BOOLEAN,
    DATETIME,
    BLOB,
    JSON,
    UUID;

    /**
     * Whether values of this type have a natural ordering usable by
     * {@code >, >=, <, <=}.
     */
    public boolean isOrdered() {
        return this == INTEGER || this == FLOAT || this == DATETIME;
    }

    /**
     * Whether pattern operators (CONTAINS, LIKE, STARTSWITH, ENDSWITH) apply.
     */
    public boolean isTextLike() {
        return this == TEXT || this == JSON;
    }

    /**
     * Whether equality and membership comparisons are meaningful.
     */
    public boolean isComparable() {
        return this != BLOB;
    }
}
