package org.kaleido.compiler.api;

import org.kaleido.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur while reading a program.
 * <p>
 * It is part of the public API and hides the internal error types of the lexer and parser.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(message, List.of());
    }

    /**
     * Constructs a new compilation exception with the specified detail message and the
     * diagnostics that caused it.
     * @param message The detail message, usually the diagnostics summary.
     * @param diagnostics The collected diagnostics.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message, null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics that caused this exception; may be empty.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
