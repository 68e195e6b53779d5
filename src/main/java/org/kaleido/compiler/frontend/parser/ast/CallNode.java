package org.kaleido.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A call of a named function.
 *
 * @param callee The name of the called function.
 * @param arguments The argument expressions, in call order.
 */
public record CallNode(String callee, List<ExprNode> arguments) implements ExprNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(arguments);
    }
}
