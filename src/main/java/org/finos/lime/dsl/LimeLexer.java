package org.finos.lime.dsl;

import org.finos.lime.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the Lime language.
 * Converts one source line into tokens, terminated by an EOF token.
 *
 * Tokens can be pulled one at a time with {@link #nextToken()} or all at once
 * with {@link #tokenize()}.
 */
public final class LimeLexer {

    private final String input;
    private final int line;
    private int position;
    private boolean finished;

    public LimeLexer(String input) {
        this(input, 1);
    }

    public LimeLexer(String input, int line) {
        this.input = stripLineTerminator(input);
        this.line = line;
        this.position = 0;
    }

    /**
     * Tokenizes the entire line.
     *
     * @return List of tokens, the last one always EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * Produces the next token. Once EOF has been returned every further call
     * returns EOF again.
     */
    public Token nextToken() {
        skipWhitespaceAndComment();
        if (finished || position >= input.length()) {
            finished = true;
            return new Token(TokenType.EOF, null, line, input.length() + 1);
        }

        char c = input.charAt(position);
        int start = position;

        if (c == ':' && position + 1 < input.length() && input.charAt(position + 1) == '=') {
            position += 2;
            return token(TokenType.ASSIGN, ":=", start);
        }

        TokenType singleCharType = punctuation(c);
        if (singleCharType != null) {
            position++;
            return token(singleCharType, String.valueOf(c), start);
        }

        if (c == '"') {
            return readStringLiteral();
        }

        if (startsNumber(position)) {
            return readNumberLiteral();
        }

        return readIdentifier();
    }

    private static TokenType punctuation(char c) {
        return switch (c) {
            case '\\' -> TokenType.LAMBDA;
            case '.' -> TokenType.DOT;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case ',' -> TokenType.COMMA;
            default -> null;
        };
    }

    private void skipWhitespaceAndComment() {
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c == ';') {
                // comment runs to end of line
                position = input.length();
            } else if (Character.isWhitespace(c)) {
                position++;
            } else {
                return;
            }
        }
    }

    private boolean startsNumber(int at) {
        char c = input.charAt(at);
        if (isDigit(c)) {
            return true;
        }
        return (c == '-' || c == '+') && at + 1 < input.length() && isDigit(input.charAt(at + 1));
    }

    // ASCII only: other Unicode digits are identifier characters
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private Token readStringLiteral() {
        int start = position;
        position++; // skip opening quote

        StringBuilder sb = new StringBuilder();
        while (position < input.length() && input.charAt(position) != '"') {
            char c = input.charAt(position);
            if (c == '\\') {
                if (position + 1 >= input.length()) {
                    break;
                }
                position++;
                char code = input.charAt(position);
                sb.append(switch (code) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    case 'b' -> '\b';
                    case 'f' -> '\f';
                    case 'v' -> '\u000B';
                    case 's' -> ' ';
                    case '"' -> '"';
                    case '\\' -> '\\';
                    default -> throw LimeParseException.lex(
                            "invalid escape code `" + code + "`", line, position + 1);
                });
            } else {
                sb.append(c);
            }
            position++;
        }

        if (position >= input.length()) {
            throw LimeParseException.lex("unterminated string literal", line, start + 1);
        }

        position++; // skip closing quote
        return token(TokenType.STRING, sb.toString(), start);
    }

    private Token readNumberLiteral() {
        int start = position;
        StringBuilder sb = new StringBuilder();

        char first = input.charAt(position);
        if (first == '-' || first == '+') {
            sb.append(first);
            position++;
        }

        while (position < input.length() && isDigit(input.charAt(position))) {
            sb.append(input.charAt(position));
            position++;
        }

        if (position < input.length() && input.charAt(position) == '.') {
            sb.append('.');
            position++;
            if (position >= input.length() || !isDigit(input.charAt(position))) {
                throw LimeParseException.lex("expected digit after decimal point", line, position + 1);
            }
            while (position < input.length() && isDigit(input.charAt(position))) {
                sb.append(input.charAt(position));
                position++;
            }
        }

        return token(TokenType.NUMBER, sb.toString(), start);
    }

    private Token readIdentifier() {
        int start = position;
        while (position < input.length() && isIdentifierPart(position)) {
            position++;
        }
        return token(TokenType.IDENTIFIER, input.substring(start, position), start);
    }

    private boolean isIdentifierPart(int at) {
        char c = input.charAt(at);
        if (Character.isWhitespace(c) || punctuation(c) != null || c == '"' || c == ';') {
            return false;
        }
        return !(c == ':' && at + 1 < input.length() && input.charAt(at + 1) == '=');
    }

    private Token token(TokenType type, String value, int start) {
        return new Token(type, value, line, start + 1);
    }

    private static String stripLineTerminator(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }
}
