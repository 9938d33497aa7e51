package com.calc.core;

/**
 * Main entry point for evaluating arithmetic expressions.
 * Each call is independent; implementations keep no state between calls.
 */
public interface Calculator {

    /**
     * Evaluate an expression written in ordinary arithmetic notation.
     *
     * @param expression Text such as {@code "2(3+4)"} or {@code "-[5! / 4]"}
     * @return Numeric result
     * @throws com.calc.exception.ParseException      if the text is not a valid expression
     * @throws com.calc.exception.EvaluationException if the value is undefined or too large
     */
    double evaluate(String expression);
}
