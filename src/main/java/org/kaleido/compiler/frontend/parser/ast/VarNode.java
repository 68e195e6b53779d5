package org.kaleido.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Introduces local variables for the extent of its body: {@code var a = 1, b = 2 in body}.
 *
 * @param bindings The variables, in declaration order.
 * @param body The expression in which the variables are visible.
 */
public record VarNode(List<Binding> bindings, ExprNode body) implements ExprNode {

    /**
     * A single {@code name = initializer} pair.
     *
     * @param name The variable name.
     * @param initializer The initial value.
     */
    public record Binding(String name, ExprNode initializer) {}

    public VarNode {
        bindings = List.copyOf(bindings);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        bindings.forEach(binding -> children.add(binding.initializer()));
        children.add(body);
        return children;
    }
}
