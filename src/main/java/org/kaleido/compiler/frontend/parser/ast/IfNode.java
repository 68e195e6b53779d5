package org.kaleido.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A conditional expression. Both branches are mandatory since the whole
 * construct has a value.
 *
 * @param condition The condition; any value other than 0.0 counts as true.
 * @param thenBranch The value if the condition holds.
 * @param elseBranch The value otherwise.
 */
public record IfNode(ExprNode condition, ExprNode thenBranch, ExprNode elseBranch) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, thenBranch, elseBranch);
    }
}
