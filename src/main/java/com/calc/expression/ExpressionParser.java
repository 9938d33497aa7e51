package com.calc.expression;

import com.calc.exception.ErrorKind;
import com.calc.exception.ParseException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds an expression tree from a token sequence.
 * <p>
 * Operators are resolved in precedence passes. Each pass sweeps the working
 * sequence left to right, folds every operator of its class together with
 * the neighbouring operands into a single node, and hands a new sequence to
 * the next pass:
 * <pre>
 * grouping   ( ... )      recursive
 * factorial  x!           postfix
 * power      x ^ y        left-associative
 * product    x * y, x / y left-associative
 * sum        x + y, x - y left-associative
 * </pre>
 * Note that {@code 2^3^2} is {@code (2^3)^2}. Groups may nest at most
 * {@link #MAX_NESTING} levels deep.
 */
public final class ExpressionParser {

    /**
     * Deepest accepted group nesting.
     */
    public static final int MAX_NESTING = 500;

    private static final Set<TokenType> POWER = EnumSet.of(TokenType.CARET);
    private static final Set<TokenType> PRODUCT = EnumSet.of(TokenType.STAR, TokenType.SLASH);
    private static final Set<TokenType> SUM = EnumSet.of(TokenType.PLUS, TokenType.MINUS);

    private final List<Token> tokens;

    public ExpressionParser(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Parse the token sequence into a tree.
     *
     * @return Root node; every operator node is fully saturated
     * @throws ParseException if grouping is unmatched or too deep, an operator
     *                        lacks an operand, or a group is empty
     */
    public Node parse() {
        List<Item> items = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            items.add(token.isNumber()
                    ? new Operand(Node.literal(token.value()))
                    : new Symbol(token.type()));
        }
        return build(List.copyOf(items), 0);
    }

    private static Node build(List<Item> items, int depth) {
        if (items.isEmpty()) {
            throw new ParseException(ErrorKind.EMPTY_EXPRESSION, "Empty expression or group.");
        }

        List<Item> reduced = reduceGroups(items, depth);
        reduced = reduceFactorials(reduced);
        reduced = reduceBinary(reduced, POWER, ErrorKind.INVALID_POWER_OPERANDS,
                "Exponent without appropriate groups or numbers before and after it.");
        reduced = reduceBinary(reduced, PRODUCT, ErrorKind.INVALID_OPERAND,
                "* or / without appropriate groups or numbers before and after it.");
        reduced = reduceBinary(reduced, SUM, ErrorKind.INVALID_OPERAND,
                "+ or - without appropriate groups or numbers before and after it.");

        if (reduced.size() != 1) {
            throw new ParseException(ErrorKind.INVALID_OPERAND, "Missing operator between numbers or groups.");
        }
        return ((Operand) reduced.get(0)).node();
    }

    private static List<Item> reduceGroups(List<Item> items, int depth) {
        List<Item> result = new ArrayList<>();
        int i = 0;
        while (i < items.size()) {
            Item item = items.get(i);
            if (isSymbol(item, TokenType.LPAREN)) {
                if (depth >= MAX_NESTING) {
                    throw new ParseException(ErrorKind.NESTING_TOO_DEEP,
                            "Parentheses are nested more than " + MAX_NESTING + " levels deep.");
                }
                int close = findClose(items, i);
                result.add(new Operand(build(items.subList(i + 1, close), depth + 1)));
                i = close + 1;
            } else if (isSymbol(item, TokenType.RPAREN)) {
                throw unmatched();
            } else {
                result.add(item);
                i++;
            }
        }
        return result;
    }

    private static int findClose(List<Item> items, int open) {
        int depth = 0;
        for (int i = open; i < items.size(); i++) {
            Item item = items.get(i);
            if (isSymbol(item, TokenType.LPAREN)) {
                depth++;
            } else if (isSymbol(item, TokenType.RPAREN)) {
                depth--;
            }
            if (depth == 0) {
                return i;
            }
        }
        throw unmatched();
    }

    private static List<Item> reduceFactorials(List<Item> items) {
        List<Item> result = new ArrayList<>();
        for (Item item : items) {
            if (!isSymbol(item, TokenType.BANG)) {
                result.add(item);
                continue;
            }
            int last = result.size() - 1;
            if (last < 0 || !(result.get(last) instanceof Operand operand)) {
                throw new ParseException(ErrorKind.INVALID_FACTORIAL_OPERAND,
                        "Factorial without an appropriate group or number preceding it.");
            }
            result.set(last, new Operand(Node.factorial(operand.node())));
        }
        return result;
    }

    private static List<Item> reduceBinary(List<Item> items, Set<TokenType> operators,
                                           ErrorKind kind, String message) {
        List<Item> result = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            if (!(item instanceof Symbol symbol) || !operators.contains(symbol.type())) {
                result.add(item);
                continue;
            }

            int last = result.size() - 1;
            Item left = last < 0 ? null : result.get(last);
            Item right = i + 1 < items.size() ? items.get(i + 1) : null;
            if (!(left instanceof Operand) || !(right instanceof Operand)) {
                throw new ParseException(kind, message);
            }

            Node node = Node.binary(BinaryOperation.of(symbol.type()),
                    ((Operand) left).node(), ((Operand) right).node());
            result.set(last, new Operand(node));
            i++; // right operand consumed
        }
        return result;
    }

    private static boolean isSymbol(Item item, TokenType type) {
        return item instanceof Symbol symbol && symbol.type() == type;
    }

    private static ParseException unmatched() {
        return new ParseException(ErrorKind.UNMATCHED_PARENTHESES, "Unmatched parentheses.");
    }

    /**
     * Element of a working sequence: a resolved subtree or a pending symbol.
     */
    private sealed interface Item permits Operand, Symbol {
    }

    private record Operand(Node node) implements Item {
    }

    private record Symbol(TokenType type) implements Item {
    }
}
