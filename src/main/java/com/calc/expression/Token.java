package com.calc.expression;

/**
 * Represents a token in a normalized expression.
 * Tokens keep no position; errors are reported structurally.
 *
 * @param type  Token type
 * @param value Numeric value, only meaningful for {@link TokenType#NUMBER}
 */
public record Token(TokenType type, double value) {

    public static Token number(double value) {
        return new Token(TokenType.NUMBER, value);
    }

    public static Token symbol(TokenType type) {
        if (type == TokenType.NUMBER) {
            throw new IllegalArgumentException("NUMBER is not a symbol token");
        }
        return new Token(type, 0.0);
    }

    public boolean isNumber() {
        return type == TokenType.NUMBER;
    }

    @Override
    public String toString() {
        if (type == TokenType.NUMBER) {
            return type + "(" + value + ")";
        }
        return type + "(" + type.symbol() + ")";
    }
}
