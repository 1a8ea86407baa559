package com.purchasingpower.hybridquery.query;

/**
 * Operators of a {@link LogicalGroup}.
 */
public enum LogicalOperator {
    AND,
    OR
}
