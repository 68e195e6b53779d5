package org.kaleido.compiler.frontend.lexer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The reserved words of the language.
 */
public enum Keyword {
    DEF("def"),
    EXTERN("extern"),
    IF("if"),
    THEN("then"),
    ELSE("else"),
    FOR("for"),
    IN("in"),
    VAR("var"),
    BINARY("binary"),
    UNARY("unary");

    private static final Map<String, Keyword> BY_SPELLING = new HashMap<>();

    static {
        for (Keyword keyword : values()) {
            BY_SPELLING.put(keyword.spelling, keyword);
        }
    }

    private final String spelling;

    Keyword(String spelling) {
        this.spelling = spelling;
    }

    /**
     * @return The exact source spelling of this keyword.
     */
    public String spelling() {
        return spelling;
    }

    /**
     * Looks up a keyword by its exact (case-sensitive) spelling.
     * @param text The identifier text collected by the lexer.
     * @return The keyword, or empty if the text is an ordinary identifier.
     */
    public static Optional<Keyword> fromSpelling(String text) {
        return Optional.ofNullable(BY_SPELLING.get(text));
    }

    @Override
    public String toString() {
        return spelling;
    }
}
