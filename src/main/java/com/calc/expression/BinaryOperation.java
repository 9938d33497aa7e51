package com.calc.expression;

/**
 * Binary infix operations.
 */
public enum BinaryOperation {
    ADD('+', TokenType.PLUS),
    SUBTRACT('-', TokenType.MINUS),
    MULTIPLY('*', TokenType.STAR),
    DIVIDE('/', TokenType.SLASH),
    POWER('^', TokenType.CARET);

    private final char symbol;
    private final TokenType tokenType;

    BinaryOperation(char symbol, TokenType tokenType) {
        this.symbol = symbol;
        this.tokenType = tokenType;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * Get the operation written by a token type.
     *
     * @param type Operator token type
     * @return Matching operation
     * @throws IllegalArgumentException if the token type is not a binary operator
     */
    public static BinaryOperation of(TokenType type) {
        for (BinaryOperation operation : values()) {
            if (operation.tokenType == type) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Not a binary operator: " + type);
    }
}
