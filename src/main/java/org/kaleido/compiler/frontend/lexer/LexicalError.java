package org.kaleido.compiler.frontend.lexer;

import org.kaleido.compiler.api.SourceInfo;

/**
 * A lexical error produced by the {@link Lexer} in place of a token.
 * The lexer keeps scanning after an error; it is up to the consumer to decide
 * whether the error is fatal.
 *
 * @param kind What went wrong.
 * @param text The offending source text (the whole malformed number, or the single character).
 * @param line The line of the first offending character.
 * @param column The column of the first offending character.
 * @param fileName The logical file name.
 */
public record LexicalError(
        Kind kind,
        String text,
        int line,
        int column,
        String fileName
) {

    /**
     * The kinds of lexical errors.
     */
    public enum Kind {
        /** A run of digits and dots that is not a valid number, e.g. {@code 1.4.2}. */
        INVALID_NUMBER,
        /** A character that cannot start any token, e.g. a control character. */
        UNEXPECTED_CHARACTER
    }

    /**
     * @return A human-readable description of the error, without the position.
     */
    public String message() {
        return switch (kind) {
            case INVALID_NUMBER -> "Invalid number format: " + text;
            case UNEXPECTED_CHARACTER -> String.format("Unexpected character: U+%04X", text.codePointAt(0));
        };
    }

    /**
     * @return The source position of the error.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }

    @Override
    public String toString() {
        return String.format("%s at %s: %s", kind, sourceInfo(), message());
    }
}
