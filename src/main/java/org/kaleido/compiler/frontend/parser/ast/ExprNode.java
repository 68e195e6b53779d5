package org.kaleido.compiler.frontend.parser.ast;

/**
 * An expression. The language has no statements, so every construct below the
 * top level is one of these.
 */
public sealed interface ExprNode extends AstNode
        permits NumberLiteralNode, VariableNode, UnaryNode, BinaryNode, CallNode, IfNode, ForNode, VarNode {
}
