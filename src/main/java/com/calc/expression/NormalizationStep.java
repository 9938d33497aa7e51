package com.calc.expression;

import java.util.function.UnaryOperator;

import static com.calc.expression.ExpressionConfig.*;

/**
 * Rewrites applied to a validated expression before it is split into tokens.
 * Each step is a pure string transformation; {@link #pipeline()} applies
 * them in declaration order, and later steps rely on earlier ones.
 */
public enum NormalizationStep implements UnaryOperator<String> {

    /**
     * Drop whitespace and thousands separators.
     */
    STRIP_SEPARATORS {
        @Override
        public String apply(String input) {
            return Rewrites.SEPARATORS.matcher(input).replaceAll("");
        }
    },

    /**
     * Square brackets group exactly like parentheses.
     */
    UNIFY_BRACKETS {
        @Override
        public String apply(String input) {
            return input.replace(Operators.LEFT_BRACKET, Operators.LEFT_PAREN)
                    .replace(Operators.RIGHT_BRACKET, Operators.RIGHT_PAREN);
        }
    },

    /**
     * Accept {@code **} as the power operator.
     */
    UNIFY_POWER {
        @Override
        public String apply(String input) {
            return Rewrites.DOUBLE_STAR.matcher(input).replaceAll("^");
        }
    },

    /**
     * A minus sign in prefix position before a numeral becomes a multiplication by {@code (0-1)}.
     */
    REWRITE_NEGATIVE_NUMBERS {
        @Override
        public String apply(String input) {
            String replacement = Rewrites.NEGATIVE_ONE_TIMES + "$1";
            String result = Rewrites.NEGATIVE_NUMBER_AT_START.matcher(input).replaceAll(replacement);
            return Rewrites.NEGATIVE_NUMBER_AFTER_OPERATOR.matcher(result).replaceAll(replacement);
        }
    },

    /**
     * A minus sign in prefix position before a group becomes a multiplication by {@code (0-1)}.
     */
    REWRITE_NEGATIVE_GROUPS {
        @Override
        public String apply(String input) {
            String replacement = Rewrites.NEGATIVE_ONE_TIMES + "(";
            String result = Rewrites.NEGATIVE_GROUP_AT_START.matcher(input).replaceAll(replacement);
            return Rewrites.NEGATIVE_GROUP_AFTER_OPERATOR.matcher(result).replaceAll(replacement);
        }
    },

    /**
     * Make juxtaposition next to a group an explicit multiplication.
     */
    INSERT_IMPLICIT_MULTIPLICATION {
        @Override
        public String apply(String input) {
            String result = Rewrites.DIGIT_BEFORE_GROUP.matcher(input).replaceAll("$1*(");
            result = Rewrites.GROUP_BEFORE_DIGIT.matcher(result).replaceAll(")*$1");
            return Rewrites.GROUP_BEFORE_GROUP.matcher(result).replaceAll(")*(");
        }
    };

    /**
     * Compose every step, in order, into a single rewrite.
     */
    public static UnaryOperator<String> pipeline() {
        return input -> {
            String result = input;
            for (NormalizationStep step : values()) {
                result = step.apply(result);
            }
            return result;
        };
    }
}
