package org.finos.lime.engine.runtime;

import org.finos.lime.dsl.LimeException.Kind;
import org.finos.lime.dsl.LimeExpression;

import java.util.Objects;

/**
 * A deferred computation: an expression, the environment it must be evaluated
 * in, and a memoization cell.
 *
 * The first {@link #force()} evaluates and caches the value; every later force
 * returns the same value without evaluating again. Caching is per instance:
 * two thunks over the same expression are forced independently.
 */
public final class Thunk {

    private enum State {
        PENDING,
        FORCING,
        FORCED
    }

    private LimeExpression expression;
    private Environment environment;
    private ExpressionEvaluator evaluator;
    private LimeValue value;
    private State state;

    private Thunk(LimeExpression expression, Environment environment, ExpressionEvaluator evaluator) {
        this.expression = expression;
        this.environment = environment;
        this.evaluator = evaluator;
        this.state = State.PENDING;
    }

    private Thunk(LimeValue value) {
        this.value = value;
        this.state = State.FORCED;
    }

    /**
     * Creates an unforced thunk.
     */
    public static Thunk deferred(LimeExpression expression, Environment environment, ExpressionEvaluator evaluator) {
        return new Thunk(
                Objects.requireNonNull(expression, "Expression cannot be null"),
                Objects.requireNonNull(environment, "Environment cannot be null"),
                Objects.requireNonNull(evaluator, "Evaluator cannot be null"));
    }

    /**
     * Creates a thunk that is already forced to {@code value}.
     */
    public static Thunk of(LimeValue value) {
        return new Thunk(Objects.requireNonNull(value, "Value cannot be null"));
    }

    /**
     * Returns the value, evaluating it on the first call.
     *
     * @throws LimeEvaluationException if evaluation fails, or if the value is
     *         demanded again while it is still being computed
     */
    public LimeValue force() {
        switch (state) {
            case FORCED:
                return value;
            case FORCING:
                throw new LimeEvaluationException(Kind.RECURSION_LIMIT_EXCEEDED,
                        "value depends on itself (infinite recursion)");
            default:
                break;
        }

        state = State.FORCING;
        try {
            value = evaluator.evaluate(expression, environment);
        } finally {
            state = value == null ? State.PENDING : State.FORCED;
        }

        // the captured scope is no longer needed
        expression = null;
        environment = null;
        evaluator = null;
        return value;
    }

    public boolean isForced() {
        return state == State.FORCED;
    }

    @Override
    public String toString() {
        return switch (state) {
            case FORCED -> "Thunk[" + value.display() + "]";
            case FORCING -> "Thunk[forcing]";
            default -> "Thunk[" + expression + "]";
        };
    }
}
