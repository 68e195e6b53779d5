package org.kaleido.compiler.frontend.parser.ast;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.kaleido.compiler.frontend.lexer.Lexer;
import org.kaleido.compiler.frontend.parser.Parser;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the generic child access of AST nodes.
 */
public class AstNodeTest {

    private static ExprNode parse(String source) {
        return new Parser(new Lexer(source)).parseExpression().value();
    }

    /**
     * Verifies that a for loop lists start, end, the explicit step and the body, in source order.
     */
    @Test
    @Tag("unit")
    void testForChildrenInSourceOrder() {
        // Act
        List<AstNode> withStep = parse("for i = 0, i < n, 2 in f(i)").getChildren();
        List<AstNode> withoutStep = parse("for i = 0, n in i").getChildren();

        // Assert
        assertThat(withStep).containsExactly(
                new NumberLiteralNode(0),
                new BinaryNode('<', new VariableNode("i"), new VariableNode("n")),
                new NumberLiteralNode(2),
                new CallNode("f", List.of(new VariableNode("i"))));
        assertThat(withoutStep).containsExactly(
                new NumberLiteralNode(0), new VariableNode("n"), new VariableNode("i"));
    }

    /**
     * Verifies that a var expression lists its initializers in declaration order, then the body.
     */
    @Test
    @Tag("unit")
    void testVarChildrenInSourceOrder() {
        // Act
        List<AstNode> children = parse("var a = 1, b = 2 in a + b").getChildren();

        // Assert
        assertThat(children).containsExactly(
                new NumberLiteralNode(1),
                new NumberLiteralNode(2),
                new BinaryNode('+', new VariableNode("a"), new VariableNode("b")));
    }

    /**
     * Verifies that leaves have no children and that the implicit step is a fresh node per call.
     */
    @Test
    @Tag("unit")
    void testLeavesAndDefaultStep() {
        // Arrange
        ForNode loop = new ForNode("i", new NumberLiteralNode(0), new VariableNode("n"), Optional.empty(), new VariableNode("i"));

        // Act & Assert
        assertThat(new NumberLiteralNode(1).getChildren()).isEmpty();
        assertThat(new VariableNode("x").getChildren()).isEmpty();
        assertThat(loop.stepOrDefault()).isEqualTo(new NumberLiteralNode(1));
        assertThat(loop.stepOrDefault()).isNotSameAs(loop.stepOrDefault());
    }
}
