package org.kaleido.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An application of a built-in or user-declared binary operator.
 *
 * @param operator The operator symbol.
 * @param lhs The left operand.
 * @param rhs The right operand.
 */
public record BinaryNode(char operator, ExprNode lhs, ExprNode rhs) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(lhs, rhs);
    }
}
