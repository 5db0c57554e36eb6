package org.finos.lime.dsl;

import java.util.Objects;

/**
 * Top-level binding statement: name := expression
 */
public record BindingExpression(
        String name,
        LimeExpression expression) implements LimeExpression {

    public BindingExpression {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
    }
}
