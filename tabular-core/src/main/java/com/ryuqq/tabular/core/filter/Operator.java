package com.ryuqq.tabular.core.filter;

/**
 * Comparison operators supported in a {@link Condition}.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public enum Operator {

    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return true for IS NULL / IS NOT NULL, which take no operand
     */
    public boolean isUnary() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    static Operator fromSymbol(String symbol) {
        String normalized = symbol.trim().replaceAll("\\s+", " ").toUpperCase();
        if ("!=".equals(normalized)) {
            return NE;
        }
        for (Operator operator : values()) {
            if (operator.symbol.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unsupported operator: " + symbol);
    }
}
