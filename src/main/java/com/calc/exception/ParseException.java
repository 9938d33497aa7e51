package com.calc.exception;

/**
 * Exception thrown when an expression cannot be tokenized or turned into a tree.
 */
public class ParseException extends CalcException {

    public ParseException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public ParseException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
