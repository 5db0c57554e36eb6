package org.finos.lime.engine.runtime;

import org.finos.lime.dsl.LimeExpression;

import java.util.Objects;

/**
 * A user function: one parameter, a body and the environment the lambda was
 * evaluated in.
 */
public final class Closure implements FunctionValue {

    private final String parameter;
    private final LimeExpression body;
    private final Environment captured;
    private final ExpressionEvaluator evaluator;

    public Closure(String parameter, LimeExpression body, Environment captured, ExpressionEvaluator evaluator) {
        this.parameter = Objects.requireNonNull(parameter, "Parameter cannot be null");
        this.body = Objects.requireNonNull(body, "Body cannot be null");
        this.captured = Objects.requireNonNull(captured, "Environment cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
    }

    @Override
    public LimeValue apply(Thunk argument) {
        return evaluator.evaluate(body, captured.extend(parameter, argument));
    }

    public String parameter() {
        return parameter;
    }

    public LimeExpression body() {
        return body;
    }

    @Override
    public String display() {
        return "<function \\" + parameter + ">";
    }

    @Override
    public String toString() {
        return display();
    }
}
