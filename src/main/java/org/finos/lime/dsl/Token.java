package org.finos.lime.dsl;

/**
 * Represents a token produced by the Lime lexer.
 *
 * @param type   The token type
 * @param value  The token text (identifier name, number text, decoded string)
 * @param line   The 1-based source line
 * @param column The 1-based column of the first character
 */
public record Token(TokenType type, String value, int line, int column) {

    public enum TokenType {
        // Identifiers and literals
        IDENTIFIER, // fact, +, cat
        NUMBER, // 42, -3.5
        STRING, // "hello"

        // Punctuation
        LAMBDA, // \
        DOT, // .
        ASSIGN, // :=
        LPAREN, // (
        RPAREN, // )
        LBRACKET, // [
        RBRACKET, // ]
        COMMA, // ,

        // Special
        EOF, // End of line
    }

    /**
     * Describes the token for error messages.
     */
    public String describe() {
        return switch (type) {
            case EOF -> "end of line";
            case STRING -> "string \"" + value + "\"";
            default -> "`" + value + "`";
        };
    }

    @Override
    public String toString() {
        return type + (value != null ? "(" + value + ")" : "") + "@" + line + ":" + column;
    }
}
