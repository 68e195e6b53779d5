package org.kaleido.compiler.frontend.parser.ast;

/**
 * An AST node that represents a numeric literal.
 *
 * @param value The value of the literal.
 */
public record NumberLiteralNode(double value) implements ExprNode {
    // This node has no children and inherits the empty list from getChildren().
}
