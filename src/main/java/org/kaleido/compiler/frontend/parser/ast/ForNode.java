package org.kaleido.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A counting loop: {@code for i = start, end, step in body}.
 *
 * @param loopVariable The name of the loop variable, scoped to the loop.
 * @param start The initial value of the loop variable.
 * @param end The loop condition, evaluated before each iteration.
 * @param step The increment, if given explicitly.
 * @param body The loop body.
 */
public record ForNode(
        String loopVariable,
        ExprNode start,
        ExprNode end,
        Optional<ExprNode> step,
        ExprNode body
) implements ExprNode {

    /**
     * @return The explicit step, or a new literal 1.0.
     */
    public ExprNode stepOrDefault() {
        return step.orElseGet(() -> new NumberLiteralNode(1.0));
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(start);
        children.add(end);
        step.ifPresent(children::add);
        children.add(body);
        return children;
    }
}
