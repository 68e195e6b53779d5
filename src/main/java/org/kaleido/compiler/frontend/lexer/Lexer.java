package org.kaleido.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced on demand, one per {@link #nextToken()} call, so the parser never
 * needs the whole stream in memory. A lexical error is returned in place of a token and
 * scanning resumes right after the offending text. Once the end of the input is reached
 * the lexer keeps returning the same {@link TokenType#END_OF_FILE} token.
 * <p>
 * The lexer holds no state besides its position, so a new instance over the same text
 * always yields the identical sequence.
 */
public class Lexer {

    private final String source;
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine;
    private int startColumn;
    private LexResult endOfFile;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, String logicalFileName) {
        this.source = source;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Scans the next token.
     * @return The next token, or the lexical error found in its place.
     */
    public LexResult nextToken() {
        if (endOfFile != null) {
            return endOfFile;
        }

        skipWhitespaceAndComments();

        start = current;
        startLine = line;
        startColumn = column;

        if (isAtEnd()) {
            endOfFile = new LexResult.Ok(new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName));
            return endOfFile;
        }

        char c = advance();
        if (isAlpha(c)) {
            return identifier();
        }
        if (isDigit(c) || (c == '.' && isDigit(peek()))) {
            return number();
        }
        if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
            // Supplementary characters are never part of the grammar.
            advance();
            return error(LexicalError.Kind.UNEXPECTED_CHARACTER);
        }
        if (!isOperatorChar(c)) {
            return error(LexicalError.Kind.UNEXPECTED_CHARACTER);
        }
        return token(TokenType.OPERATOR, null);
    }

    /**
     * Drains the lexer up to and including the end-of-file token.
     * @return Every token and lexical error, in source order.
     */
    public List<LexResult> scanAll() {
        List<LexResult> results = new ArrayList<>();
        LexResult result;
        do {
            result = nextToken();
            results.add(result);
        } while (!result.isOk() || result.token().type() != TokenType.END_OF_FILE);
        return results;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '#') {
                // A comment goes until the end of the line; the newline itself is whitespace.
                while (peek() != '\n' && !isAtEnd()) advance();
            } else if (c == '\n') {
                current++;
                line++;
                column = 1;
            } else if (Character.isWhitespace(c)) {
                advance();
            } else {
                return;
            }
        }
    }

    private LexResult identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        return Keyword.fromSpelling(text)
                .map(keyword -> token(TokenType.KEYWORD, keyword))
                .orElseGet(() -> token(TokenType.IDENTIFIER, null));
    }

    private LexResult number() {
        // Take the maximal run of digits and dots, then validate it as a whole.
        int dots = previous() == '.' ? 1 : 0;
        while (isDigit(peek()) || peek() == '.') {
            if (advance() == '.') dots++;
        }

        if (dots > 1) {
            return error(LexicalError.Kind.INVALID_NUMBER);
        }
        String numberString = source.substring(start, current);
        try {
            return token(TokenType.NUMBER, Double.parseDouble(numberString));
        } catch (NumberFormatException e) {
            return error(LexicalError.Kind.INVALID_NUMBER);
        }
    }

    private LexResult token(TokenType type, Object value) {
        String text = source.substring(start, current);
        return new LexResult.Ok(new Token(type, text, value, startLine, startColumn, logicalFileName));
    }

    private LexResult error(LexicalError.Kind kind) {
        String text = source.substring(start, current);
        return new LexResult.Error(new LexicalError(kind, text, startLine, startColumn, logicalFileName));
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private boolean isOperatorChar(char c) {
        if (Character.isLetterOrDigit(c) || Character.isWhitespace(c)) {
            return false;
        }
        return switch (Character.getType(c)) {
            case Character.CONTROL, Character.FORMAT, Character.UNASSIGNED,
                    Character.PRIVATE_USE, Character.SURROGATE -> false;
            default -> true;
        };
    }
}
