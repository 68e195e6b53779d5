package org.kaleido.compiler.frontend.parser.ast;

import java.util.List;
import java.util.OptionalInt;

/**
 * The signature of a function: its name and parameter names. Operator
 * declarations use the same node, with the operator symbol as the name.
 * <p>
 * Standing alone (from {@code extern}), a prototype declares a function
 * implemented elsewhere.
 *
 * @param name The function name, or the operator symbol if {@code isOperator} is set.
 * @param parameters The parameter names, in order.
 * @param isOperator Whether this declares a unary (one parameter) or binary (two parameters) operator.
 * @param operatorPrecedence The precedence written in a {@code binary} declaration, if any.
 */
public record PrototypeNode(
        String name,
        List<String> parameters,
        boolean isOperator,
        OptionalInt operatorPrecedence
) implements TopLevelNode {

    public PrototypeNode {
        parameters = List.copyOf(parameters);
    }

    /**
     * Creates the prototype of an ordinary function.
     * @param name The function name.
     * @param parameters The parameter names.
     * @return The prototype.
     */
    public static PrototypeNode function(String name, List<String> parameters) {
        return new PrototypeNode(name, parameters, false, OptionalInt.empty());
    }

    @Override
    public PrototypeNode prototype() {
        return this;
    }

    /**
     * @return true if this declares a unary operator.
     */
    public boolean isUnaryOperator() {
        return isOperator && parameters.size() == 1;
    }

    /**
     * @return true if this declares a binary operator.
     */
    public boolean isBinaryOperator() {
        return isOperator && parameters.size() == 2;
    }

    /**
     * @return The declared operator symbol.
     * @throws IllegalStateException if this is not an operator declaration.
     */
    public char operatorSymbol() {
        if (!isOperator) {
            throw new IllegalStateException("'" + name + "' does not declare an operator.");
        }
        return name.charAt(0);
    }

    /**
     * The symbol name under which the code generator registers this function.
     * Operators are prefixed with their fixity, e.g. {@code binary|} or {@code unary!},
     * which is also how it resolves {@link BinaryNode} and {@link UnaryNode} applications
     * of user-declared operators.
     *
     * @return The linkage name.
     */
    public String mangledName() {
        if (!isOperator) {
            return name;
        }
        return (isUnaryOperator() ? "unary" : "binary") + name;
    }
}
