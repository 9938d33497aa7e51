package com.calc.expression;

/**
 * Unary operations, all postfix.
 */
public enum UnaryOperation {
    FACTORIAL('!');

    private final char symbol;

    UnaryOperation(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }
}
