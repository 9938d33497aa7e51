package com.calc.expression;

import com.calc.exception.EvaluationException;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Evaluates expression trees bottom-up.
 * Stateless; a single instance can be shared between threads.
 */
public final class ExpressionEvaluator {

    /**
     * Largest n whose factorial is finite as a double.
     */
    static final int MAX_FACTORIAL = 170;

    /**
     * Evaluate a tree to a number.
     * Works with an explicit stack, so tree depth is not bounded by the thread stack.
     *
     * @param root Root of the tree
     * @return Finite result
     * @throws EvaluationException if an operation is undefined for its operands
     *                             or its result is too large for a double
     */
    public double evaluate(Node root) {
        Deque<Step> steps = new ArrayDeque<>();
        Deque<Double> values = new ArrayDeque<>();
        steps.push(new Visit(root));

        while (!steps.isEmpty()) {
            Step step = steps.pop();
            if (step instanceof Reduce reduce) {
                values.push(reduce(reduce.node(), values));
                continue;
            }

            Node node = ((Visit) step).node();
            if (node instanceof Node.Literal literal) {
                values.push(checkLiteral(literal.value()));
            } else if (node instanceof Node.UnaryOp unary) {
                steps.push(new Reduce(unary));
                steps.push(new Visit(unary.operand()));
            } else if (node instanceof Node.BinaryOp binary) {
                // left is popped, and evaluated, first
                steps.push(new Reduce(binary));
                steps.push(new Visit(binary.right()));
                steps.push(new Visit(binary.left()));
            } else {
                throw new IllegalStateException("Unknown node: " + node);
            }
        }
        return values.pop();
    }

    private static double reduce(Node node, Deque<Double> values) {
        if (node instanceof Node.UnaryOp unary) {
            double operand = values.pop();
            return switch (unary.operation()) {
                case FACTORIAL -> factorial(operand);
            };
        }
        Node.BinaryOp binary = (Node.BinaryOp) node;
        double right = values.pop();
        double left = values.pop();
        return apply(binary.operation(), left, right);
    }

    private static double checkLiteral(double value) {
        if (Double.isInfinite(value)) {
            throw EvaluationException.overflow("Number is too large to represent.");
        }
        return value;
    }

    private static double apply(BinaryOperation operation, double left, double right) {
        double result = switch (operation) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> divide(left, right);
            case POWER -> power(left, right);
        };
        if (Double.isInfinite(result)) {
            throw EvaluationException.overflow("Result of " + operation.symbol() + " is too large to represent.");
        }
        return result;
    }

    private static double divide(double left, double right) {
        if (right == 0.0) {
            throw EvaluationException.domain("Division by zero.");
        }
        return left / right;
    }

    private static double power(double base, double exponent) {
        if (base == 0.0 && exponent < 0) {
            throw EvaluationException.domain("Zero cannot be raised to a negative power.");
        }
        double result = Math.pow(base, exponent);
        if (Double.isNaN(result)) {
            throw EvaluationException.domain("Negative number cannot be raised to a fractional power.");
        }
        return result;
    }

    private static double factorial(double operand) {
        if (operand < 0 || operand != Math.floor(operand)) {
            throw EvaluationException.domain("Factorial is only defined for non-negative integers.");
        }
        if (operand > MAX_FACTORIAL) {
            throw EvaluationException.overflow("Factorial is too large to represent.");
        }
        BigInteger result = BigInteger.ONE;
        for (int i = 2; i <= (int) operand; i++) {
            result = result.multiply(BigInteger.valueOf(i));
        }
        return result.doubleValue();
    }

    /**
     * Pending work: visit a subtree, or combine the values of its evaluated operands.
     */
    private sealed interface Step permits Visit, Reduce {
    }

    private record Visit(Node node) implements Step {
    }

    private record Reduce(Node node) implements Step {
    }
}
