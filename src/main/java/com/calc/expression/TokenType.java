package com.calc.expression;

/**
 * Token types for arithmetic expressions.
 */
public enum TokenType {
    // Literals
    NUMBER('\0'),

    // Grouping
    LPAREN('('),
    RPAREN(')'),

    // Operators
    PLUS('+'),
    MINUS('-'),
    STAR('*'),
    SLASH('/'),
    CARET('^'),
    BANG('!');

    private final char symbol;

    TokenType(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * Look up the symbol token type for a character.
     *
     * @param c Operator or bracket character
     * @return Matching token type, or null if the character is not a symbol
     */
    public static TokenType fromSymbol(char c) {
        for (TokenType type : values()) {
            if (type != NUMBER && type.symbol == c) {
                return type;
            }
        }
        return null;
    }
}
