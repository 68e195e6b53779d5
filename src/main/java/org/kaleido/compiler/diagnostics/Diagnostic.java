package org.kaleido.compiler.diagnostics;

import org.kaleido.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error, warning)
 * that occurs while reading a program.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param sourceInfo Where the issue occurred.
 */
public record Diagnostic(
        Type type,
        String message,
        SourceInfo sourceInfo
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, sourceInfo, message);
    }
}
