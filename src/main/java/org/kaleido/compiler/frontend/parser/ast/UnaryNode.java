package org.kaleido.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An application of a user-declared unary operator.
 *
 * @param operator The operator symbol.
 * @param operand The operand.
 */
public record UnaryNode(char operator, ExprNode operand) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
