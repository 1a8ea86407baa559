package com.purchasingpower.hybridquery.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Comparison operators for relational filters. Serialized by symbol.
 *
 * @since 1.0.0
 */
public enum RelationalOperator {
    EQ("=="),
    NE("!="),
    GT(">"),
    GE(">="),
    LT("<"),
    LE("<="),
    CONTAINS("CONTAINS"),
    LIKE("LIKE"),
    STARTS_WITH("STARTSWITH"),
    ENDS_WITH("ENDSWITH"),
    IN("IN");

    private final String symbol;

    RelationalOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    public boolean isOrdering() {
        return this == GT || this == GE || this == LT || this == LE;
    }

    public boolean isPattern() {
        return this == CONTAINS || this == LIKE || this == STARTS_WITH || this == ENDS_WITH;
    }

    /**
     * Resolve an operator from its symbol, case-insensitively for the word operators.
     *
     * @throws IllegalArgumentException if the symbol is unknown
     */
    @JsonCreator
    public static RelationalOperator fromSymbol(String symbol) {
        return Arrays.stream(values())
            .filter(op -> op.symbol.equalsIgnoreCase(symbol.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown relational operator: " + symbol));
    }

    @Override
    public String toString() {
        return symbol;
    }
}
