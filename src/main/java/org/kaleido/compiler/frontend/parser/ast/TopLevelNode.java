package org.kaleido.compiler.frontend.parser.ast;

/**
 * An item at the top level of a program: a function definition or a bare
 * prototype declared with {@code extern}.
 */
public sealed interface TopLevelNode extends AstNode permits PrototypeNode, FunctionNode {

    /**
     * @return The signature of this item.
     */
    PrototypeNode prototype();
}
