package com.calc.expression;

import java.util.regex.Pattern;

/**
 * Configuration for expression normalization: accepted characters,
 * operator symbols and the rewrite patterns applied before tokenizing.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Any character outside digits, separators, operators, brackets and whitespace.
     */
    public static final Pattern INVALID_CHARACTER = Pattern.compile("[^0-9.,+\\-*/()\\[\\]!^\\s]");

    public static final String ALLOWED_CHARACTERS_MESSAGE =
            "The only allowable characters are 0-9, +, -, *, /, !, ^, ., comma, "
                    + "parentheses, and square brackets.";

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char DOT = '.';

        private Operators() {
        }
    }

    /**
     * Rewrite patterns, in the order the normalization steps use them.
     */
    public static final class Rewrites {
        public static final Pattern SEPARATORS = Pattern.compile("[\\s,]");
        public static final Pattern DOUBLE_STAR = Pattern.compile("\\*\\*");

        // -5+6 -> (0-1)*5+6, 5*-6 -> 5*(0-1)*6
        public static final Pattern NEGATIVE_NUMBER_AT_START = Pattern.compile("^-([\\d.]+)");
        public static final Pattern NEGATIVE_NUMBER_AFTER_OPERATOR = Pattern.compile("(?<=[-+*/(])-([\\d.]+)");

        // -(1+2) -> (0-1)*(1+2)
        public static final Pattern NEGATIVE_GROUP_AT_START = Pattern.compile("^-\\(");
        public static final Pattern NEGATIVE_GROUP_AFTER_OPERATOR = Pattern.compile("(?<=[-+*/(])-\\(");

        // 2(3+4), (2+3)4, (2+3)(4+5)
        public static final Pattern DIGIT_BEFORE_GROUP = Pattern.compile("(\\d)\\(");
        public static final Pattern GROUP_BEFORE_DIGIT = Pattern.compile("\\)(\\d)");
        public static final Pattern GROUP_BEFORE_GROUP = Pattern.compile("\\)\\(");

        /**
         * Fragment boundaries: every character that is not part of a numeral.
         */
        public static final Pattern SYMBOL = Pattern.compile("[^\\d.]");

        public static final String NEGATIVE_ONE_TIMES = "(0-1)*";

        private Rewrites() {
        }
    }
}
