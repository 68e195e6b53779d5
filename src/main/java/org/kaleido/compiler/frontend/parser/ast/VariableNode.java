package org.kaleido.compiler.frontend.parser.ast;

/**
 * An AST node that represents a reference to a variable, such as a function parameter,
 * a loop variable or a binding introduced by {@code var}.
 *
 * @param name The name of the variable.
 */
public record VariableNode(String name) implements ExprNode {
}
