package org.kaleido.compiler.frontend.parser.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders AST nodes as compact S-expressions, e.g. {@code (+ 1 (* 2 3))}.
 * Used for debug logging and for readable assertions in tests.
 */
public final class AstPrinter {

    private AstPrinter() {}

    /**
     * Prints a node and all of its children.
     * @param node The node to print.
     * @return The S-expression.
     */
    public static String print(AstNode node) {
        StringBuilder sb = new StringBuilder();
        print(node, sb);
        return sb.toString();
    }

    /**
     * Prints a list of top-level items, one per line.
     * @param items The items to print.
     * @return The S-expressions separated by newlines.
     */
    public static String print(List<? extends AstNode> items) {
        return items.stream().map(AstPrinter::print).collect(Collectors.joining("\n"));
    }

    private static void print(AstNode node, StringBuilder sb) {
        if (node instanceof NumberLiteralNode n) {
            sb.append(formatNumber(n.value()));
        } else if (node instanceof VariableNode v) {
            sb.append(v.name());
        } else if (node instanceof UnaryNode u) {
            sb.append("(unary ").append(u.operator()).append(' ');
            print(u.operand(), sb);
            sb.append(')');
        } else if (node instanceof BinaryNode b) {
            sb.append('(').append(b.operator()).append(' ');
            print(b.lhs(), sb);
            sb.append(' ');
            print(b.rhs(), sb);
            sb.append(')');
        } else if (node instanceof CallNode c) {
            sb.append("(call ").append(c.callee());
            for (ExprNode arg : c.arguments()) {
                sb.append(' ');
                print(arg, sb);
            }
            sb.append(')');
        } else if (node instanceof IfNode i) {
            sb.append("(if ");
            print(i.condition(), sb);
            sb.append(' ');
            print(i.thenBranch(), sb);
            sb.append(' ');
            print(i.elseBranch(), sb);
            sb.append(')');
        } else if (node instanceof ForNode f) {
            sb.append("(for ").append(f.loopVariable()).append(' ');
            print(f.start(), sb);
            sb.append(' ');
            print(f.end(), sb);
            sb.append(' ');
            print(f.stepOrDefault(), sb);
            sb.append(' ');
            print(f.body(), sb);
            sb.append(')');
        } else if (node instanceof VarNode v) {
            sb.append("(var (");
            for (int i = 0; i < v.bindings().size(); i++) {
                VarNode.Binding binding = v.bindings().get(i);
                if (i > 0) sb.append(' ');
                sb.append('(').append(binding.name()).append(' ');
                print(binding.initializer(), sb);
                sb.append(')');
            }
            sb.append(") ");
            print(v.body(), sb);
            sb.append(')');
        } else if (node instanceof PrototypeNode p) {
            sb.append("(extern ");
            printSignature(p, sb);
            sb.append(')');
        } else if (node instanceof FunctionNode f) {
            sb.append("(def ");
            printSignature(f.prototype(), sb);
            sb.append(' ');
            print(f.body(), sb);
            sb.append(')');
        } else {
            throw new IllegalArgumentException("Unknown AST node: " + node);
        }
    }

    private static void printSignature(PrototypeNode p, StringBuilder sb) {
        if (p.isOperator()) {
            sb.append(p.isUnaryOperator() ? "unary" : "binary").append(p.name());
            p.operatorPrecedence().ifPresent(prec -> sb.append(' ').append(prec));
        } else {
            sb.append(p.name());
        }
        sb.append(" (").append(String.join(" ", p.parameters())).append(')');
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
