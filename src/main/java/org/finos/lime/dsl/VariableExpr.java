package org.finos.lime.dsl;

import java.util.Objects;

/**
 * Reference to a bound name, including builtin operators such as {@code +}.
 *
 * @param name The identifier text
 */
public record VariableExpr(String name) implements LimeExpression {

    public VariableExpr {
        Objects.requireNonNull(name, "Name cannot be null");
    }
}
