package org.finos.lime.dsl;

import org.finos.lime.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive descent parser for one Lime statement.
 *
 * Grammar:
 * line := IDENT ":=" expr | expr | (nothing)
 * expr := atom atom* (left-associative application)
 * atom := IDENT | NUMBER | STRING | "(" ")" | "(" expr ")"
 *       | "[" "]" | "[" expr ("," expr)* "]" | "\" IDENT? "." expr
 *
 * A lambda body extends as far right as possible: to the closing
 * parenthesis or bracket, a list comma, or the end of the line.
 */
public final class LimeParser {

    private final List<Token> tokens;
    private int position;

    public LimeParser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
        this.position = 0;
    }

    /**
     * Parses a Lime source line.
     *
     * @param line       The source text
     * @param lineNumber The 1-based line number used in error locations
     * @return The statement, or empty for a blank or comment-only line
     */
    public static Optional<LimeExpression> parse(String line, int lineNumber) {
        LimeLexer lexer = new LimeLexer(line, lineNumber);
        return new LimeParser(lexer.tokenize()).parseStatement();
    }

    /**
     * Parses a single expression, failing on blank input.
     */
    public static LimeExpression parseExpression(String source) {
        LimeParser parser = new LimeParser(new LimeLexer(source).tokenize());
        LimeExpression expr = parser.parseExpression();
        parser.consume(TokenType.EOF, "Expected end of line");
        return expr;
    }

    /**
     * Parses the whole token list as one statement.
     */
    public Optional<LimeExpression> parseStatement() {
        if (check(TokenType.EOF)) {
            return Optional.empty();
        }

        LimeExpression statement;
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
            String name = advance().value();
            advance(); // :=
            statement = new BindingExpression(name, parseExpression());
        } else {
            statement = parseExpression();
        }

        consume(TokenType.EOF, null);
        return Optional.of(statement);
    }

    /**
     * Parses a left-associative application chain.
     */
    private LimeExpression parseExpression() {
        if (!startsAtom()) {
            throw LimeParseException.unexpected(peek(), "Expected an expression");
        }

        LimeExpression expr = parseAtom();
        while (startsAtom()) {
            expr = new ApplicationExpr(expr, parseAtom());
        }
        return expr;
    }

    private boolean startsAtom() {
        return switch (peek().type()) {
            case IDENTIFIER, NUMBER, STRING, LPAREN, LBRACKET, LAMBDA -> true;
            default -> false;
        };
    }

    private LimeExpression parseAtom() {
        Token token = advance();
        return switch (token.type()) {
            case IDENTIFIER -> new VariableExpr(token.value());
            case NUMBER -> LiteralExpr.number(parseNumber(token));
            case STRING -> LiteralExpr.string(token.value());
            case LPAREN -> parseParenthesized();
            case LBRACKET -> parseList();
            case LAMBDA -> parseLambda();
            default -> throw LimeParseException.unexpected(token, "Expected an expression");
        };
    }

    private static double parseNumber(Token token) {
        try {
            return Double.parseDouble(token.value());
        } catch (NumberFormatException e) {
            throw LimeParseException.lex("invalid number literal `" + token.value() + "`",
                    token.line(), token.column());
        }
    }

    /**
     * Parses what follows '(': either the none literal "()" or a nested expression.
     */
    private LimeExpression parseParenthesized() {
        if (check(TokenType.RPAREN)) {
            advance();
            return LiteralExpr.none();
        }
        LimeExpression expr = parseExpression();
        consume(TokenType.RPAREN, "Expected ')'");
        return expr;
    }

    /**
     * Parses what follows '[': elements separated by commas, then ']'.
     */
    private LimeExpression parseList() {
        List<LimeExpression> elements = new ArrayList<>();
        if (check(TokenType.RBRACKET)) {
            advance();
            return new ListLiteral(elements);
        }

        elements.add(parseExpression());
        while (check(TokenType.COMMA)) {
            advance();
            elements.add(parseExpression());
        }
        consume(TokenType.RBRACKET, "Expected ',' or ']'");
        return new ListLiteral(elements);
    }

    /**
     * Parses what follows '\': the parameter, the dot and the body.
     */
    private LimeExpression parseLambda() {
        String parameter;
        if (check(TokenType.DOT)) {
            parameter = LambdaExpression.IGNORED;
        } else {
            parameter = consume(TokenType.IDENTIFIER, "Expected parameter name after '\\'").value();
        }
        consume(TokenType.DOT, "Expected '.' after lambda parameter");
        return new LambdaExpression(parameter, parseExpression());
    }

    // ==================== Helper methods ====================

    private Token peek() {
        return tokens.get(position);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        return position + 1 < tokens.size() && tokens.get(position + 1).type() == type;
    }

    private Token advance() {
        Token token = tokens.get(position);
        if (token.type() != TokenType.EOF) {
            position++;
        }
        return token;
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) {
            return advance();
        }
        throw LimeParseException.unexpected(peek(), errorMessage);
    }
}
