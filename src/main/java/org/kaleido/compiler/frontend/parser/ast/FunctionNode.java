package org.kaleido.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A function definition. Top-level expressions are wrapped into anonymous
 * functions without parameters so the code generator has a single entry point.
 *
 * @param prototype The signature.
 * @param body The body expression, whose value is the function result.
 * @param isAnonymous Whether this function wraps a top-level expression.
 */
public record FunctionNode(PrototypeNode prototype, ExprNode body, boolean isAnonymous) implements TopLevelNode {

    /**
     * Name prefix of the functions wrapping top-level expressions. The '#' keeps the
     * generated names apart from anything the lexer accepts as an identifier.
     */
    public static final String ANONYMOUS_PREFIX = "__anon_expr#";

    /**
     * Creates a named function definition.
     * @param prototype The signature.
     * @param body The body expression.
     */
    public FunctionNode(PrototypeNode prototype, ExprNode body) {
        this(prototype, body, false);
    }

    /**
     * Wraps a top-level expression.
     * @param index The running number of the wrapper within one parser.
     * @param body The expression.
     * @return The anonymous function {@code __anon_expr#<index>} without parameters.
     */
    public static FunctionNode anonymous(int index, ExprNode body) {
        return new FunctionNode(PrototypeNode.function(ANONYMOUS_PREFIX + index, List.of()), body, true);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(prototype, body);
    }
}
