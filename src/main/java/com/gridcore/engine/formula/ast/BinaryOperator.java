package com.gridcore.engine.formula.ast;

/**
 * Binary operators with their source symbol and binding strength (higher binds tighter).
 */
public enum BinaryOperator {
    EQUAL("=", 1),
    NOT_EQUAL("<>", 1),
    LESS_THAN("<", 1),
    LESS_THAN_OR_EQUAL("<=", 1),
    GREATER_THAN(">", 1),
    GREATER_THAN_OR_EQUAL(">=", 1),
    CONCAT("&", 2),
    ADD("+", 3),
    SUBTRACT("-", 3),
    MULTIPLY("*", 4),
    DIVIDE("/", 4),
    POWER("^", 5);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == 1;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }
}
