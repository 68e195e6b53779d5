package org.kaleido.compiler.diagnostics;

import org.kaleido.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur while reading a program.
 * <p>
 * This decouples error reporting from the lexer and parser, which only return error values.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param sourceInfo Where the error occurred.
     */
    public void reportError(String message, SourceInfo sourceInfo) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, sourceInfo));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param sourceInfo Where the issue occurred.
     */
    public void reportWarning(String message, SourceInfo sourceInfo) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, sourceInfo));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The number of reported errors.
     */
    public int errorCount() {
        return (int) diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
