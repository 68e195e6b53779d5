package org.kaleido.compiler.frontend.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * The operators known to one {@link Parser}: binary operators with their precedence
 * (higher binds tighter) and the declared unary operators.
 * <p>
 * A fresh table holds only the built-in binary operators. {@code binary} and {@code unary}
 * declarations extend it while parsing, so an operator can only be used after its declaration.
 * Tables are never shared between parsers.
 */
public class OperatorTable {

    /** Lowest precedence a declaration may use. */
    public static final int MIN_PRECEDENCE = 1;
    /** Highest precedence a declaration may use. */
    public static final int MAX_PRECEDENCE = 100;

    private final Map<Character, Integer> binaryPrecedences = new HashMap<>();
    private final Set<Character> unaryOperators = new HashSet<>();

    /**
     * Creates a table seeded with the built-in operators {@code < + - * /}.
     */
    public OperatorTable() {
        binaryPrecedences.put('<', 10);
        binaryPrecedences.put('+', 20);
        binaryPrecedences.put('-', 20);
        binaryPrecedences.put('*', 40);
        binaryPrecedences.put('/', 40);
    }

    /**
     * Gets the precedence of a binary operator.
     * @param symbol The operator symbol.
     * @return The precedence, or empty if the symbol is not a binary operator.
     */
    public OptionalInt binaryPrecedence(char symbol) {
        Integer precedence = binaryPrecedences.get(symbol);
        return precedence == null ? OptionalInt.empty() : OptionalInt.of(precedence);
    }

    /**
     * @return true if the symbol is a known binary operator.
     */
    public boolean isBinary(char symbol) {
        return binaryPrecedences.containsKey(symbol);
    }

    /**
     * @return true if the symbol has been declared as a unary operator.
     */
    public boolean isUnary(char symbol) {
        return unaryOperators.contains(symbol);
    }

    /**
     * Inserts or overwrites a binary operator.
     * @param symbol The operator symbol.
     * @param precedence The precedence, between {@link #MIN_PRECEDENCE} and {@link #MAX_PRECEDENCE}.
     * @throws IllegalArgumentException if the precedence is out of range.
     */
    public void declareBinary(char symbol, int precedence) {
        if (precedence < MIN_PRECEDENCE || precedence > MAX_PRECEDENCE) {
            throw new IllegalArgumentException("Precedence of '" + symbol + "' must be between "
                    + MIN_PRECEDENCE + " and " + MAX_PRECEDENCE + ", was " + precedence);
        }
        binaryPrecedences.put(symbol, precedence);
    }

    /**
     * Declares a unary operator.
     * @param symbol The operator symbol.
     */
    public void declareUnary(char symbol) {
        unaryOperators.add(symbol);
    }

    /**
     * @return An unmodifiable view of all binary operators and their precedences.
     */
    public Map<Character, Integer> binaryOperators() {
        return Collections.unmodifiableMap(binaryPrecedences);
    }

    /**
     * @return An unmodifiable view of all declared unary operators.
     */
    public Set<Character> unaryOperators() {
        return Collections.unmodifiableSet(unaryOperators);
    }
}
