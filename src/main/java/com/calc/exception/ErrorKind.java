package com.calc.exception;

/**
 * Classification of calculator failures.
 */
public enum ErrorKind {
    // Tokenizing
    INVALID_CHARACTER,
    UNBALANCED_BRACKETS,
    MALFORMED_NUMBER,

    // Tree building
    UNMATCHED_PARENTHESES,
    INVALID_FACTORIAL_OPERAND,
    INVALID_POWER_OPERANDS,
    INVALID_OPERAND,
    EMPTY_EXPRESSION,
    NESTING_TOO_DEEP,

    // Evaluation
    DOMAIN_ERROR,
    OVERFLOW,

    // Startup
    CONFIGURATION
}
