package org.kaleido.compiler.api;

import org.kaleido.compiler.frontend.parser.ast.FunctionNode;
import org.kaleido.compiler.frontend.parser.ast.PrototypeNode;
import org.kaleido.compiler.frontend.parser.ast.TopLevelNode;

import java.util.List;

/**
 * The result of a successful front-end run, handed to the code generator as a whole.
 * <p>
 * A code generator registers every {@link #externs() extern}, generates every
 * {@link #functions() function}, and in interactive use runs each
 * {@link #anonymousFunctions() anonymous function} right after generating it.
 *
 * @param programName The name the program was read under.
 * @param items The top-level items in source order.
 */
public record ParsedProgram(String programName, List<TopLevelNode> items) {

    public ParsedProgram {
        items = List.copyOf(items);
    }

    /**
     * @return All function definitions, including the anonymous wrappers of top-level expressions.
     */
    public List<FunctionNode> functions() {
        return items.stream()
                .filter(FunctionNode.class::isInstance)
                .map(FunctionNode.class::cast)
                .toList();
    }

    /**
     * @return The bare prototypes declared with {@code extern}.
     */
    public List<PrototypeNode> externs() {
        return items.stream()
                .filter(PrototypeNode.class::isInstance)
                .map(PrototypeNode.class::cast)
                .toList();
    }

    /**
     * @return The functions wrapping top-level expressions, in source order.
     */
    public List<FunctionNode> anonymousFunctions() {
        return functions().stream().filter(FunctionNode::isAnonymous).toList();
    }
}
