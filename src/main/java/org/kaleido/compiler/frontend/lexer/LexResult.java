package org.kaleido.compiler.frontend.lexer;

/**
 * The outcome of a single {@link Lexer#nextToken()} call: either a token or a lexical error.
 */
public sealed interface LexResult permits LexResult.Ok, LexResult.Error {

    /**
     * A successfully scanned token.
     * @param token The token.
     */
    record Ok(Token token) implements LexResult {}

    /**
     * A lexical error in place of a token.
     * @param error The error.
     */
    record Error(LexicalError error) implements LexResult {}

    /**
     * @return true if this result holds a token.
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * @return The token.
     * @throws IllegalStateException if this result is an error.
     */
    default Token token() {
        if (this instanceof Ok ok) {
            return ok.token();
        }
        throw new IllegalStateException("Lexical error, no token: " + ((Error) this).error());
    }

    /**
     * @return The lexical error.
     * @throws IllegalStateException if this result holds a token.
     */
    default LexicalError error() {
        if (this instanceof Error err) {
            return err.error();
        }
        throw new IllegalStateException("No lexical error, got token: " + ((Ok) this).token());
    }
}
