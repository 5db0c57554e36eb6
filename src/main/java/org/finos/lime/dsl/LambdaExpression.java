package org.finos.lime.dsl;

import java.util.Objects;

/**
 * Represents a single-parameter lambda.
 *
 * Example: \a.\b.a parses as LambdaExpression("a", LambdaExpression("b", a))
 *
 * @param parameter The parameter name, or {@link #IGNORED} for {@code \.body}
 * @param body      The lambda body expression
 */
public record LambdaExpression(
        String parameter,
        LimeExpression body) implements LimeExpression {

    /** Parameter name used by {@code \.body}; no identifier can spell it. */
    public static final String IGNORED = "";

    public LambdaExpression {
        Objects.requireNonNull(parameter, "Parameter cannot be null");
        Objects.requireNonNull(body, "Body cannot be null");
    }

    public boolean ignoresArgument() {
        return IGNORED.equals(parameter);
    }
}
