package com.calc.exception;

/**
 * Exception thrown when a well-formed tree cannot be reduced to a number.
 * Either the operation is undefined for its operands or the result
 * does not fit in a double.
 */
public class EvaluationException extends CalcException {

    public EvaluationException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public static EvaluationException domain(String message) {
        return new EvaluationException(ErrorKind.DOMAIN_ERROR, message);
    }

    public static EvaluationException overflow(String message) {
        return new EvaluationException(ErrorKind.OVERFLOW, message);
    }
}
