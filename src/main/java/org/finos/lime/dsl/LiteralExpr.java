package org.finos.lime.dsl;

import java.util.Objects;

/**
 * Represents a literal value in Lime.
 *
 * Examples: 42, -3.5, "hello", ()
 *
 * @param value The literal value (Double, String, or null for none)
 * @param type  The type of literal
 */
public record LiteralExpr(
        Object value,
        LiteralType type) implements LimeExpression {

    public enum LiteralType {
        NUMBER,
        STRING,
        NONE
    }

    private static final LiteralExpr NONE = new LiteralExpr(null, LiteralType.NONE);

    public LiteralExpr {
        Objects.requireNonNull(type, "Type cannot be null");
        if (type != LiteralType.NONE) {
            Objects.requireNonNull(value, "Value cannot be null for " + type);
        }
    }

    public static LiteralExpr number(double value) {
        return new LiteralExpr(value, LiteralType.NUMBER);
    }

    public static LiteralExpr string(String value) {
        return new LiteralExpr(value, LiteralType.STRING);
    }

    public static LiteralExpr none() {
        return NONE;
    }
}
