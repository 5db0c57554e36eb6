package org.finos.lime.dsl;

/**
 * Exception thrown when a Lime source line cannot be tokenized or parsed.
 * Always created with the location of the offending character or token.
 */
public class LimeParseException extends LimeException {

    public LimeParseException(Kind kind, String message, int line, int column) {
        super(kind, message, line, column);
        if (kind != Kind.LEX && kind != Kind.PARSE) {
            throw new IllegalArgumentException("Not a syntax error kind: " + kind);
        }
    }

    static LimeParseException lex(String message, int line, int column) {
        return new LimeParseException(Kind.LEX, message, line, column);
    }

    static LimeParseException unexpected(Token token, String expectation) {
        String message = expectation == null
                ? "unexpected " + token.describe()
                : expectation + " but found " + token.describe();
        return new LimeParseException(Kind.PARSE, message, token.line(), token.column());
    }
}
