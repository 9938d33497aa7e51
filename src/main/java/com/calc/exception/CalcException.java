package com.calc.exception;

/**
 * Base exception for the calculator.
 * Every failure carries the {@link ErrorKind} that classifies it.
 */
public class CalcException extends RuntimeException {

    private final ErrorKind kind;

    public CalcException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CalcException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
