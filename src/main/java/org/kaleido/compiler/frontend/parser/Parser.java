package org.kaleido.compiler.frontend.parser;

import org.kaleido.compiler.config.FrontEndOptions;
import org.kaleido.compiler.frontend.lexer.Keyword;
import org.kaleido.compiler.frontend.lexer.LexResult;
import org.kaleido.compiler.frontend.lexer.Lexer;
import org.kaleido.compiler.frontend.lexer.Token;
import org.kaleido.compiler.frontend.lexer.TokenType;
import org.kaleido.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Supplier;

/**
 * The parser of the language. It pulls tokens from a {@link Lexer} one at a time and
 * builds an Abstract Syntax Tree (AST) of definitions, externs and top-level expressions.
 * <p>
 * Binary expressions are parsed by precedence climbing over the parser's own
 * {@link OperatorTable}, which operator declarations extend while parsing; everything
 * else is plain recursive descent with a single token of lookahead and no backtracking.
 * <p>
 * Every public operation returns a {@link ParseResult}; the first syntax error ends the
 * current operation. Drivers that want to continue call {@link #synchronize()} and parse the
 * next top-level item.
 */
public class Parser {

    /** Operator characters with a fixed syntactic role; they cannot be declared as operators. */
    private static final String STRUCTURAL_SYMBOLS = "(),;";

    private final Lexer lexer;
    private final FrontEndOptions options;
    private final OperatorTable operators = new OperatorTable();
    private LexResult lookahead;
    private int anonymousCount = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser with default options.
     * @param lexer The source of tokens.
     */
    public Parser(Lexer lexer) {
        this(lexer, FrontEndOptions.defaults());
    }

    /**
     * Constructs a new Parser.
     * @param lexer The source of tokens.
     * @param options The front-end options, e.g. the default precedence of declared operators.
     */
    public Parser(Lexer lexer, FrontEndOptions options) {
        this.lexer = lexer;
        this.options = options;
    }

    /**
     * Parses all remaining top-level items, stopping at the first error.
     * @return The items in source order, or the first error.
     */
    public ParseResult<List<TopLevelNode>> parseProgram() {
        return run(() -> {
            List<TopLevelNode> items = new ArrayList<>();
            Optional<TopLevelNode> item;
            while ((item = topLevelItem()).isPresent()) {
                items.add(item.get());
            }
            return items;
        });
    }

    /**
     * Parses the next top-level item including its terminating ';'.
     * Empty items (stray ';') are skipped.
     * @return The item, an empty value at the end of the input, or the error.
     */
    public ParseResult<Optional<TopLevelNode>> parseTopLevelItem() {
        return run(this::topLevelItem);
    }

    /**
     * Parses {@code def prototype expression}. It must be followed by ';' or the end of the input;
     * the ';' is not consumed.
     * @return The function definition, or the error.
     */
    public ParseResult<FunctionNode> parseDefinition() {
        return runItem(this::definition);
    }

    /**
     * Parses {@code extern prototype}, followed by ';' or the end of the input.
     * @return The prototype, or the error.
     */
    public ParseResult<PrototypeNode> parseExtern() {
        return runItem(this::externDeclaration);
    }

    /**
     * Parses an expression and wraps it into an anonymous function without parameters.
     * It must be followed by ';' or the end of the input.
     * @return The anonymous function, or the error.
     */
    public ParseResult<FunctionNode> parseTopLevelExpression() {
        return runItem(this::topLevelExpression);
    }

    /**
     * Parses a single expression, followed by ';' or the end of the input.
     * @return The expression, or the error.
     */
    public ParseResult<ExprNode> parseExpression() {
        return runItem(this::expression);
    }

    /**
     * Skips tokens up to and including the next ';', or up to the end of the input.
     * Lexical errors on the way are discarded. Used to recover after a syntax error.
     */
    public void synchronize() {
        while (true) {
            LexResult next = lookahead();
            if (!next.isOk()) {
                lookahead = null;
                continue;
            }
            Token token = next.token();
            if (token.type() == TokenType.END_OF_FILE) {
                return;
            }
            advance();
            if (token.isOperator(';')) {
                return;
            }
        }
    }

    /**
     * @return true if the next token is the end of the input.
     */
    public boolean atEnd() {
        LexResult next = lookahead();
        return next.isOk() && next.token().type() == TokenType.END_OF_FILE;
    }

    /**
     * Returns the lookahead without consuming it. The result is an error if the lexer
     * could not scan the next token.
     * @return The next token or lexical error.
     */
    public LexResult currentToken() {
        return lookahead();
    }

    /**
     * @return The live operator table of this parser.
     */
    public OperatorTable operatorTable() {
        return operators;
    }

    /**
     * Runs a single-item production that must be followed by ';' or the end of the input.
     * The ';' is left in place.
     */
    private <T> ParseResult<T> runItem(Supplier<T> production) {
        return run(() -> {
            T item = production.get();
            if (!atEnd() && !peek().isOperator(';')) {
                rejectUnknownOperator("';'");
                throw error(ParseError.Kind.MISSING_TERMINATOR, "Unexpected input after item.", "';' or end of input", peek());
            }
            return item;
        });
    }

    private <T> ParseResult<T> run(Supplier<T> production) {
        try {
            return ParseResult.ok(production.get());
        } catch (ParseFailure failure) {
            return ParseResult.failure(failure.error);
        }
    }

    // region Top level

    private Optional<TopLevelNode> topLevelItem() {
        while (matchOperator(';')) {
            // empty item
        }
        if (check(TokenType.END_OF_FILE)) {
            return Optional.empty();
        }

        TopLevelNode item;
        if (checkKeyword(Keyword.DEF)) {
            item = definition();
        } else if (checkKeyword(Keyword.EXTERN)) {
            item = externDeclaration();
        } else {
            item = topLevelExpression();
        }
        consumeTerminator(';', "Expected ';' after top-level item.");
        return Optional.of(item);
    }

    private FunctionNode definition() {
        consumeKeyword(Keyword.DEF, "Expected 'def'.");
        PrototypeNode prototype = prototype();
        ExprNode body = expression();
        return new FunctionNode(prototype, body);
    }

    private PrototypeNode externDeclaration() {
        consumeKeyword(Keyword.EXTERN, "Expected 'extern'.");
        return prototype();
    }

    private FunctionNode topLevelExpression() {
        ExprNode body = expression();
        return FunctionNode.anonymous(anonymousCount++, body);
    }

    /**
     * prototype := identifier '(' identifier* ')'
     *            | 'unary' op '(' identifier ')'
     *            | 'binary' op number? '(' identifier identifier ')'
     */
    private PrototypeNode prototype() {
        Token start = peek();
        String name;
        Keyword fixity = null;
        OptionalInt precedence = OptionalInt.empty();

        if (check(TokenType.IDENTIFIER)) {
            name = advance().text();
        } else if (checkKeyword(Keyword.UNARY) || checkKeyword(Keyword.BINARY)) {
            fixity = (Keyword) advance().value();
            Token symbol = peek();
            if (symbol.type() != TokenType.OPERATOR || STRUCTURAL_SYMBOLS.indexOf(symbol.operatorSymbol()) >= 0) {
                throw error(ParseError.Kind.INVALID_OPERATOR_DECLARATION,
                        "Expected an operator symbol after '" + fixity + "'.", "operator symbol", symbol);
            }
            name = advance().text();
            if (fixity == Keyword.BINARY && check(TokenType.NUMBER)) {
                precedence = OptionalInt.of(precedenceLiteral(advance()));
            }
        } else {
            throw error(ParseError.Kind.UNEXPECTED_TOKEN, "Expected function name in prototype.", "function name", peek());
        }

        consumeOperator('(', "Expected '(' in prototype.");
        List<String> parameters = new ArrayList<>();
        while (check(TokenType.IDENTIFIER)) {
            parameters.add(advance().text());
        }
        if (!matchOperator(')')) {
            throw error(ParseError.Kind.MISSING_TERMINATOR, "Expected parameter name or ')' in prototype.", "')'", peek());
        }

        if (fixity == null) {
            return PrototypeNode.function(name, parameters);
        }

        int arity = fixity == Keyword.UNARY ? 1 : 2;
        if (parameters.size() != arity) {
            throw error(ParseError.Kind.INVALID_OPERATOR_DECLARATION,
                    "Invalid number of operands for " + fixity + " operator '" + name + "': expected " + arity
                            + ", got " + parameters.size() + ".",
                    arity + " parameter(s)", start);
        }

        // Registered before the body is parsed, so the body may already use the operator.
        char symbol = name.charAt(0);
        if (fixity == Keyword.UNARY) {
            operators.declareUnary(symbol);
        } else {
            operators.declareBinary(symbol, precedence.orElse(options.defaultBinaryPrecedence()));
        }
        return new PrototypeNode(name, parameters, true, precedence);
    }

    private int precedenceLiteral(Token literal) {
        double value = literal.numberValue();
        if (value != Math.rint(value) || value < OperatorTable.MIN_PRECEDENCE || value > OperatorTable.MAX_PRECEDENCE) {
            throw error(ParseError.Kind.INVALID_OPERATOR_DECLARATION,
                    "Invalid precedence: must be an integer between " + OperatorTable.MIN_PRECEDENCE
                            + " and " + OperatorTable.MAX_PRECEDENCE + ".",
                    "precedence", literal);
        }
        return (int) value;
    }

    // endregion

    // region Expressions

    private ExprNode expression() {
        return binary(0);
    }

    /**
     * Precedence climbing. All operators are left-associative: the right-hand side only
     * takes operators that bind strictly tighter. A symbol that is not a binary operator
     * ends the expression and is left for the caller.
     */
    private ExprNode binary(int minPrecedence) {
        ExprNode lhs = unary();
        while (true) {
            OptionalInt precedence = currentBinaryPrecedence();
            if (precedence.isEmpty() || precedence.getAsInt() < minPrecedence) {
                return lhs;
            }
            char operator = advance().operatorSymbol();
            ExprNode rhs = binary(precedence.getAsInt() + 1);
            lhs = new BinaryNode(operator, lhs, rhs);
        }
    }

    private OptionalInt currentBinaryPrecedence() {
        if (!check(TokenType.OPERATOR)) {
            return OptionalInt.empty();
        }
        return operators.binaryPrecedence(peek().operatorSymbol());
    }

    /**
     * Every nesting level of an expression passes through here, so the depth bounds the recursion.
     */
    private ExprNode unary() {
        if (++depth > options.maxNestingDepth()) {
            depth--;
            throw error(ParseError.Kind.NESTING_TOO_DEEP,
                    "Expression nested too deeply: more than " + options.maxNestingDepth() + " levels.",
                    "at most " + options.maxNestingDepth() + " nesting levels", peek());
        }
        try {
            if (check(TokenType.OPERATOR) && operators.isUnary(peek().operatorSymbol())) {
                char operator = advance().operatorSymbol();
                return new UnaryNode(operator, unary());
            }
            return primary();
        } finally {
            depth--;
        }
    }

    private ExprNode primary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER:
                advance();
                return new NumberLiteralNode(token.numberValue());
            case IDENTIFIER:
                return identifierExpression();
            case KEYWORD:
                if (token.isKeyword(Keyword.IF)) return ifExpression();
                if (token.isKeyword(Keyword.FOR)) return forExpression();
                if (token.isKeyword(Keyword.VAR)) return varExpression();
                break;
            case OPERATOR:
                if (token.isOperator('(')) return parenthesizedExpression();
                break;
            default:
                break;
        }
        throw error(ParseError.Kind.EXPECTED_EXPRESSION, "Expected an expression.", "expression", token);
    }

    private ExprNode parenthesizedExpression() {
        consumeOperator('(', "Expected '('.");
        ExprNode inner = expression();
        consumeTerminator(')', "Expected ')' after expression.");
        return inner;
    }

    private ExprNode identifierExpression() {
        String name = advance().text();
        if (!matchOperator('(')) {
            return new VariableNode(name);
        }

        List<ExprNode> arguments = new ArrayList<>();
        if (!matchOperator(')')) {
            do {
                arguments.add(expression());
            } while (matchOperator(','));
            consumeTerminator(')', "Expected ')' or ',' in argument list of '" + name + "'.");
        }
        return new CallNode(name, arguments);
    }

    private ExprNode ifExpression() {
        consumeKeyword(Keyword.IF, "Expected 'if'.");
        ExprNode condition = expression();
        consumeKeywordAfterExpression(Keyword.THEN, "Expected 'then' after if condition.");
        ExprNode thenBranch = expression();
        consumeKeywordAfterExpression(Keyword.ELSE, "Expected 'else' after then branch.");
        ExprNode elseBranch = expression();
        return new IfNode(condition, thenBranch, elseBranch);
    }

    private ExprNode forExpression() {
        consumeKeyword(Keyword.FOR, "Expected 'for'.");
        String loopVariable = consumeIdentifier("Expected loop variable after 'for'.");
        consumeOperator('=', "Expected '=' after loop variable.");
        ExprNode start = expression();
        consumeOperatorAfterExpression(',', "Expected ',' after for start value.");
        ExprNode end = expression();
        Optional<ExprNode> step = Optional.empty();
        if (matchOperator(',')) {
            step = Optional.of(expression());
        }
        consumeKeywordAfterExpression(Keyword.IN, "Expected 'in' after for.");
        ExprNode body = expression();
        return new ForNode(loopVariable, start, end, step, body);
    }

    private ExprNode varExpression() {
        consumeKeyword(Keyword.VAR, "Expected 'var'.");
        List<VarNode.Binding> bindings = new ArrayList<>();
        do {
            String name = consumeIdentifier("Expected variable name after 'var'.");
            consumeOperator('=', "Expected '=' after variable '" + name + "'.");
            bindings.add(new VarNode.Binding(name, expression()));
        } while (matchOperator(','));
        consumeKeywordAfterExpression(Keyword.IN, "Expected 'in' after var bindings.");
        ExprNode body = expression();
        return new VarNode(bindings, body);
    }

    // endregion

    // region Token stream

    private LexResult lookahead() {
        if (lookahead == null) {
            lookahead = lexer.nextToken();
        }
        return lookahead;
    }

    private Token peek() {
        LexResult next = lookahead();
        if (!next.isOk()) {
            throw new ParseFailure(ParseError.lexical(next.error()));
        }
        return next.token();
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != TokenType.END_OF_FILE) {
            lookahead = null;
        }
        return token;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkKeyword(Keyword keyword) {
        return peek().isKeyword(keyword);
    }

    private boolean matchOperator(char symbol) {
        if (peek().isOperator(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    private void consumeKeyword(Keyword keyword, String errorMessage) {
        if (!checkKeyword(keyword)) {
            throw error(ParseError.Kind.UNEXPECTED_TOKEN, errorMessage, "'" + keyword + "'", peek());
        }
        advance();
    }

    private void consumeKeywordAfterExpression(Keyword keyword, String errorMessage) {
        if (!checkKeyword(keyword)) {
            rejectUnknownOperator("'" + keyword + "'");
        }
        consumeKeyword(keyword, errorMessage);
    }

    private String consumeIdentifier(String errorMessage) {
        if (!check(TokenType.IDENTIFIER)) {
            throw error(ParseError.Kind.UNEXPECTED_TOKEN, errorMessage, "identifier", peek());
        }
        return advance().text();
    }

    private void consumeOperator(char symbol, String errorMessage) {
        if (!matchOperator(symbol)) {
            throw error(ParseError.Kind.UNEXPECTED_TOKEN, errorMessage, "'" + symbol + "'", peek());
        }
    }

    private void consumeOperatorAfterExpression(char symbol, String errorMessage) {
        if (!peek().isOperator(symbol)) {
            rejectUnknownOperator("'" + symbol + "'");
        }
        consumeOperator(symbol, errorMessage);
    }

    /**
     * Consumes a closing ';' or ')'.
     */
    private void consumeTerminator(char symbol, String errorMessage) {
        if (matchOperator(symbol)) {
            return;
        }
        rejectUnknownOperator("'" + symbol + "'");
        throw error(ParseError.Kind.MISSING_TERMINATOR, errorMessage, "'" + symbol + "'", peek());
    }

    /**
     * Called where an expression has just ended. An operator symbol in the next position that is
     * not a binary operator means the expression ended on an undeclared operator.
     */
    private void rejectUnknownOperator(String expected) {
        Token found = peek();
        if (found.type() == TokenType.OPERATOR
                && STRUCTURAL_SYMBOLS.indexOf(found.operatorSymbol()) < 0
                && !operators.isBinary(found.operatorSymbol())) {
            throw error(ParseError.Kind.UNKNOWN_OPERATOR,
                    "Unknown operator '" + found.text() + "'.", expected, found);
        }
    }

    private ParseFailure error(ParseError.Kind kind, String message, String expected, Token found) {
        return new ParseFailure(ParseError.at(kind, message, expected, found));
    }

    // endregion

    /**
     * Unwinds the recursive descent to the public entry point, where it becomes a {@link ParseResult}.
     */
    private static final class ParseFailure extends RuntimeException {
        private final transient ParseError error;

        ParseFailure(ParseError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
