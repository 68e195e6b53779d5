package org.kaleido.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** An identifier, such as a variable or function name. */
    IDENTIFIER,
    /** A numeric literal. The token value is the parsed {@link Double}. */
    NUMBER,

    // Keywords.
    /** A reserved word. The token value is the matching {@link Keyword}. */
    KEYWORD,

    // Symbols.
    /**
     * Any single non-alphanumeric character, such as '+', ';' or '('.
     * Custom operators are lexed the same way; the parser decides what they mean.
     */
    OPERATOR,

    // Miscellaneous.
    /** Represents the end of the source text. */
    END_OF_FILE
}
