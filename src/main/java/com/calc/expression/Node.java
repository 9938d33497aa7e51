package com.calc.expression;

import java.util.Objects;

/**
 * Element of an expression tree.
 * Trees are immutable and strictly tree shaped: every operator node owns its operands.
 */
public sealed interface Node permits Node.Literal, Node.UnaryOp, Node.BinaryOp {

    /**
     * Leaf holding a number.
     *
     * @param value Literal value
     */
    record Literal(double value) implements Node {

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * Postfix operator applied to a single operand.
     *
     * @param operation Operation to apply
     * @param operand   Operand subtree
     */
    record UnaryOp(UnaryOperation operation, Node operand) implements Node {

        public UnaryOp {
            Objects.requireNonNull(operation, "operation");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public String toString() {
            return "(" + operand + operation.symbol() + ")";
        }
    }

    /**
     * Infix operator applied to two operands.
     *
     * @param operation Operation to apply
     * @param left      Left operand subtree
     * @param right     Right operand subtree
     */
    record BinaryOp(BinaryOperation operation, Node left, Node right) implements Node {

        public BinaryOp {
            Objects.requireNonNull(operation, "operation");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " " + operation.symbol() + " " + right + ")";
        }
    }

    static Node literal(double value) {
        return new Literal(value);
    }

    static Node factorial(Node operand) {
        return new UnaryOp(UnaryOperation.FACTORIAL, operand);
    }

    static Node binary(BinaryOperation operation, Node left, Node right) {
        return new BinaryOp(operation, left, right);
    }
}
