package org.kaleido.compiler.frontend.parser;

import org.kaleido.compiler.api.SourceInfo;
import org.kaleido.compiler.frontend.lexer.LexicalError;
import org.kaleido.compiler.frontend.lexer.Token;

/**
 * A syntax error that stopped the parser. Carries enough position information
 * for a driver to report it and to resynchronize.
 *
 * @param kind What went wrong.
 * @param message A human-readable description.
 * @param expected What the parser was looking for, e.g. {@code 'else'}.
 * @param found What it got instead, e.g. {@code ';'} or {@code end of input}.
 * @param sourceInfo The position of the offending token.
 * @param lexicalError The underlying lexical error if {@code kind} is {@link Kind#LEXICAL_ERROR}, otherwise null.
 */
public record ParseError(
        Kind kind,
        String message,
        String expected,
        String found,
        SourceInfo sourceInfo,
        LexicalError lexicalError
) {

    /**
     * The kinds of syntax errors.
     */
    public enum Kind {
        /** A specific token (keyword, identifier, '=', '(') was required but another was found. */
        UNEXPECTED_TOKEN,
        /** An expression was required but the token cannot start one. */
        EXPECTED_EXPRESSION,
        /** An operator symbol was used infix before being declared as a binary operator. */
        UNKNOWN_OPERATOR,
        /** A closing ';' or ')' is missing. */
        MISSING_TERMINATOR,
        /** A {@code unary}/{@code binary} declaration with a bad symbol, precedence or operand count. */
        INVALID_OPERATOR_DECLARATION,
        /** The expression exceeds the configured nesting depth. */
        NESTING_TOO_DEEP,
        /** The lexer could not produce the next token. */
        LEXICAL_ERROR
    }

    /**
     * Creates an error located at a token.
     * @param kind The error kind.
     * @param message The description.
     * @param expected What was expected.
     * @param found The offending token.
     * @return The error.
     */
    public static ParseError at(Kind kind, String message, String expected, Token found) {
        return new ParseError(kind, message, expected, found.describe(), found.sourceInfo(), null);
    }

    /**
     * Wraps a lexical error that surfaced while the parser advanced.
     * @param error The lexical error.
     * @return The parse error.
     */
    public static ParseError lexical(LexicalError error) {
        return new ParseError(Kind.LEXICAL_ERROR, error.message(), "a valid token", "'" + error.text() + "'",
                error.sourceInfo(), error);
    }

    /**
     * @return The line of the offending token.
     */
    public int line() {
        return sourceInfo.lineNumber();
    }

    /**
     * @return The column of the offending token.
     */
    public int column() {
        return sourceInfo.columnNumber();
    }

    @Override
    public String toString() {
        return String.format("%s at %s: %s (expected %s, found %s)", kind, sourceInfo, message, expected, found);
    }
}
