package com.calc.expression;

import com.calc.exception.ErrorKind;
import com.calc.exception.ParseException;

import java.util.ArrayList;
import java.util.List;

import static com.calc.expression.ExpressionConfig.*;

/**
 * Tokenizer for arithmetic expressions.
 * Validates the raw text, normalizes ambiguous notation and converts the
 * result into a sequence of tokens.
 */
public final class ExpressionTokenizer {

    private final String input;

    public ExpressionTokenizer(String input) {
        this.input = input;
    }

    /**
     * Tokenize the input string.
     *
     * @return Immutable list of tokens, in input order
     * @throws ParseException if the input has invalid characters, unbalanced
     *                        brackets or a numeral that is not a number
     */
    public List<Token> tokenize() {
        validateCharacters();
        validateBrackets();
        return split(normalize(input));
    }

    /**
     * Apply every {@link NormalizationStep} to already validated text.
     */
    public static String normalize(String text) {
        return NormalizationStep.pipeline().apply(text);
    }

    private void validateCharacters() {
        if (INVALID_CHARACTER.matcher(input).find()) {
            throw new ParseException(ErrorKind.INVALID_CHARACTER, ALLOWED_CHARACTERS_MESSAGE);
        }
    }

    private void validateBrackets() {
        if (count(Operators.LEFT_PAREN) != count(Operators.RIGHT_PAREN)
                || count(Operators.LEFT_BRACKET) != count(Operators.RIGHT_BRACKET)) {
            throw new ParseException(ErrorKind.UNBALANCED_BRACKETS, "Unbalanced brackets or parentheses.");
        }
    }

    private long count(char c) {
        return input.chars().filter(ch -> ch == c).count();
    }

    private static List<Token> split(String normalized) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder numeral = new StringBuilder();

        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (isNumeralPart(c)) {
                numeral.append(c);
                continue;
            }

            flushNumeral(numeral, tokens);
            TokenType type = TokenType.fromSymbol(c);
            if (type == null) {
                throw new ParseException(ErrorKind.INVALID_CHARACTER, ALLOWED_CHARACTERS_MESSAGE);
            }
            tokens.add(Token.symbol(type));
        }
        flushNumeral(numeral, tokens);

        return List.copyOf(tokens);
    }

    private static void flushNumeral(StringBuilder numeral, List<Token> tokens) {
        if (numeral.length() == 0) {
            return;
        }
        String text = numeral.toString();
        numeral.setLength(0);
        try {
            tokens.add(Token.number(Double.parseDouble(text)));
        } catch (NumberFormatException e) {
            throw new ParseException(ErrorKind.MALFORMED_NUMBER, "Invalid number '" + text + "'.", e);
        }
    }

    private static boolean isNumeralPart(char c) {
        return (c >= '0' && c <= '9') || c == Operators.DOT;
    }
}
