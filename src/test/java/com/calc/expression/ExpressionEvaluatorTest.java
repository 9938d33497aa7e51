package com.calc.expression;

import com.calc.exception.ErrorKind;
import com.calc.exception.EvaluationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.calc.expression.BinaryOperation.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionEvaluator.
 */
class ExpressionEvaluatorTest {

    private ExpressionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new ExpressionEvaluator();
    }

    private static Node num(double value) {
        return new Node.Literal(value);
    }

    private static Node op(BinaryOperation operation, double left, double right) {
        return new Node.BinaryOp(operation, num(left), num(right));
    }

    private static Node fact(double operand) {
        return new Node.UnaryOp(UnaryOperation.FACTORIAL, num(operand));
    }

    @Test
    @DisplayName("Literal evaluates to its value")
    void shouldEvaluateLiteral() {
        assertEquals(4.25, evaluator.evaluate(num(4.25)));
    }

    @ParameterizedTest
    @DisplayName("Binary operations")
    @CsvSource({
            "ADD, 2, 3, 5",
            "SUBTRACT, 2, 3, -1",
            "MULTIPLY, 2, 3, 6",
            "DIVIDE, 3, 2, 1.5",
            "POWER, 2, 10, 1024",
            "POWER, 9, 0.5, 3",
            "POWER, -2, 3, -8"
    })
    void shouldApplyBinaryOperations(BinaryOperation operation, double left, double right, double expected) {
        assertEquals(expected, evaluator.evaluate(op(operation, left, right)), 1e-12);
    }

    @Test
    @DisplayName("Nested trees evaluate bottom-up")
    void shouldEvaluateNestedTree() {
        Node tree = new Node.BinaryOp(MULTIPLY,
                new Node.BinaryOp(ADD, num(2), num(3)),
                new Node.UnaryOp(UnaryOperation.FACTORIAL, num(3)));
        assertEquals(30.0, evaluator.evaluate(tree));
    }

    @Test
    @DisplayName("Very deep trees evaluate on both sides")
    void shouldEvaluateDeepTrees() {
        Node leftDeep = num(0);
        Node rightDeep = num(0);
        for (int i = 0; i < 100_000; i++) {
            leftDeep = new Node.BinaryOp(ADD, leftDeep, num(1));
            rightDeep = new Node.BinaryOp(SUBTRACT, num(1), rightDeep);
        }
        assertEquals(100_000.0, evaluator.evaluate(leftDeep));
        assertEquals(0.0, evaluator.evaluate(rightDeep));
    }

    @Test
    @DisplayName("Left operand errors are reported before right operand errors")
    void shouldEvaluateLeftOperandFirst() {
        Node tree = new Node.BinaryOp(ADD, fact(-1), op(DIVIDE, 1, 0));
        EvaluationException e = assertThrows(EvaluationException.class, () -> evaluator.evaluate(tree));
        assertEquals("Factorial is only defined for non-negative integers.", e.getMessage());
    }

    @ParameterizedTest
    @DisplayName("Factorial of non-negative integers")
    @CsvSource({"0, 1", "1, 1", "5, 120", "10, 3628800", "20, 2432902008176640000"})
    void shouldComputeFactorial(double operand, double expected) {
        assertEquals(expected, evaluator.evaluate(fact(operand)));
    }

    @Test
    @DisplayName("Largest representable factorial stays finite")
    void shouldComputeLargestFactorial() {
        double result = evaluator.evaluate(fact(ExpressionEvaluator.MAX_FACTORIAL));
        assertFalse(Double.isInfinite(result));
        assertTrue(result > 7.25e306);
    }

    @ParameterizedTest
    @DisplayName("Factorial rejects negative and fractional operands")
    @CsvSource({"-1", "2.5", "-0.5"})
    void shouldRejectFactorialDomain(double operand) {
        EvaluationException e = assertThrows(EvaluationException.class, () -> evaluator.evaluate(fact(operand)));
        assertEquals(ErrorKind.DOMAIN_ERROR, e.getKind());
    }

    @Test
    @DisplayName("Factorial above 170 overflows")
    void shouldOverflowLargeFactorial() {
        assertEquals(ErrorKind.OVERFLOW,
                assertThrows(EvaluationException.class, () -> evaluator.evaluate(fact(171))).getKind());
        assertEquals(ErrorKind.OVERFLOW,
                assertThrows(EvaluationException.class, () -> evaluator.evaluate(fact(1e300))).getKind());
    }

    @Test
    @DisplayName("Division by zero is a domain error")
    void shouldRejectDivisionByZero() {
        EvaluationException e = assertThrows(EvaluationException.class,
                () -> evaluator.evaluate(op(DIVIDE, 1, 0)));
        assertEquals(ErrorKind.DOMAIN_ERROR, e.getKind());
    }

    @Test
    @DisplayName("Undefined powers are domain errors")
    void shouldRejectUndefinedPowers() {
        assertEquals(ErrorKind.DOMAIN_ERROR,
                assertThrows(EvaluationException.class, () -> evaluator.evaluate(op(POWER, 0, -1))).getKind());
        assertEquals(ErrorKind.DOMAIN_ERROR,
                assertThrows(EvaluationException.class, () -> evaluator.evaluate(op(POWER, -8, 0.5))).getKind());
    }

    @Test
    @DisplayName("Results beyond double range overflow")
    void shouldDetectOverflow() {
        assertEquals(ErrorKind.OVERFLOW,
                assertThrows(EvaluationException.class, () -> evaluator.evaluate(op(POWER, 10, 400))).getKind());
        assertEquals(ErrorKind.OVERFLOW,
                assertThrows(EvaluationException.class, () -> evaluator.evaluate(op(MULTIPLY, 1e308, 10))).getKind());
        assertEquals(ErrorKind.OVERFLOW,
                assertThrows(EvaluationException.class, () -> evaluator.evaluate(op(SUBTRACT, -1e308, 1e308))).getKind());
    }

    @Test
    @DisplayName("Literal too large for a double overflows")
    void shouldRejectInfiniteLiteral() {
        EvaluationException e = assertThrows(EvaluationException.class,
                () -> evaluator.evaluate(num(Double.POSITIVE_INFINITY)));
        assertEquals(ErrorKind.OVERFLOW, e.getKind());
    }
}
