package org.kaleido.compiler.frontend.lexer;

import org.kaleido.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Identifier, Number, Operator).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: a {@link Double} for numbers,
 *              a {@link Keyword} for keywords, otherwise {@code null}.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * @return true if this token is the given keyword.
     */
    public boolean isKeyword(Keyword keyword) {
        return type == TokenType.KEYWORD && value == keyword;
    }

    /**
     * @return true if this token is the single-character operator {@code symbol}.
     */
    public boolean isOperator(char symbol) {
        return type == TokenType.OPERATOR && text.charAt(0) == symbol;
    }

    /**
     * Gets the symbol of an operator token.
     * @return The operator character.
     * @throws IllegalStateException if this is not an operator token.
     */
    public char operatorSymbol() {
        if (type != TokenType.OPERATOR) {
            throw new IllegalStateException("Not an operator token: " + this);
        }
        return text.charAt(0);
    }

    /**
     * Gets the numeric value of a number token.
     * @return The value as a double.
     */
    public double numberValue() {
        return (Double) value;
    }

    /**
     * @return The source position of this token.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }

    /**
     * A short human-readable description for diagnostics, e.g. {@code 'then'} or {@code end of input}.
     * @return The description.
     */
    public String describe() {
        return type == TokenType.END_OF_FILE ? "end of input" : "'" + text + "'";
    }
}
