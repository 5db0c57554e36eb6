package org.finos.lime.dsl;

import java.util.Objects;

/**
 * Application of a function to exactly one argument.
 * {@code f a b} is ApplicationExpr(ApplicationExpr(f, a), b).
 *
 * @param function The expression producing the function
 * @param argument The argument expression, evaluated on demand
 */
public record ApplicationExpr(
        LimeExpression function,
        LimeExpression argument) implements LimeExpression {

    public ApplicationExpr {
        Objects.requireNonNull(function, "Function cannot be null");
        Objects.requireNonNull(argument, "Argument cannot be null");
    }
}
