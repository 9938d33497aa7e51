package com.calc.core;

import com.calc.expression.ExpressionEvaluator;
import com.calc.expression.ExpressionParser;
import com.calc.expression.ExpressionTokenizer;
import com.calc.expression.Node;
import com.calc.expression.Token;

import java.util.List;
import java.util.Objects;

/**
 * Default calculator: tokenize, build the tree, evaluate.
 * The first failure aborts the pipeline and reaches the caller unchanged.
 */
public class DefaultCalculator implements Calculator {

    private final ExpressionEvaluator evaluator;

    public DefaultCalculator() {
        this(new ExpressionEvaluator());
    }

    public DefaultCalculator(ExpressionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    @Override
    public double evaluate(String expression) {
        Objects.requireNonNull(expression, "expression");
        List<Token> tokens = new ExpressionTokenizer(expression).tokenize();
        Node tree = new ExpressionParser(tokens).parse();
        return evaluator.evaluate(tree);
    }
}
