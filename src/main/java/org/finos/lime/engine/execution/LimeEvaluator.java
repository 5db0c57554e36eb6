package org.finos.lime.engine.execution;

import org.finos.lime.dsl.ApplicationExpr;
import org.finos.lime.dsl.BindingExpression;
import org.finos.lime.dsl.LambdaExpression;
import org.finos.lime.dsl.LimeException.Kind;
import org.finos.lime.dsl.LimeExpression;
import org.finos.lime.dsl.ListLiteral;
import org.finos.lime.dsl.LiteralExpr;
import org.finos.lime.dsl.VariableExpr;
import org.finos.lime.engine.runtime.Closure;
import org.finos.lime.engine.runtime.Environment;
import org.finos.lime.engine.runtime.ExpressionEvaluator;
import org.finos.lime.engine.runtime.FunctionValue;
import org.finos.lime.engine.runtime.LimeEvaluationException;
import org.finos.lime.engine.runtime.LimeValue;
import org.finos.lime.engine.runtime.ListValue;
import org.finos.lime.engine.runtime.NoneValue;
import org.finos.lime.engine.runtime.NumberValue;
import org.finos.lime.engine.runtime.StringValue;
import org.finos.lime.engine.runtime.Thunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Call-by-need evaluator for Lime expressions.
 *
 * Arguments are never evaluated at the call site: each one is wrapped in a
 * {@link Thunk} over the caller's environment and forced only when its value
 * is needed. List literals are the exception; their elements are evaluated
 * eagerly, so a list always holds plain values.
 */
public final class LimeEvaluator implements ExpressionEvaluator {

    /**
     * Executes a top-level statement.
     *
     * A binding stores an unforced thunk under its name and yields nothing.
     * The thunk sees the top level as it is now, so the expression may refer
     * to an earlier binding of the same name but never to later ones.
     * Any other expression is evaluated and its value returned.
     *
     * @param statement The parsed statement
     * @param topLevel  The mutable top-level frame
     */
    public Optional<LimeValue> execute(LimeExpression statement, Environment topLevel) {
        if (!topLevel.isTopLevel()) {
            throw new IllegalArgumentException("Statements execute against the top-level environment");
        }
        if (statement instanceof BindingExpression binding) {
            topLevel.define(binding.name(), Thunk.deferred(binding.expression(), topLevel.snapshot(), this));
            return Optional.empty();
        }
        return Optional.of(evaluate(statement, topLevel));
    }

    @Override
    public LimeValue evaluate(LimeExpression expression, Environment environment) {
        if (expression instanceof LiteralExpr literal) {
            return literalValue(literal);
        }
        if (expression instanceof VariableExpr variable) {
            return environment.resolve(variable.name());
        }
        if (expression instanceof ApplicationExpr application) {
            return evaluateApplication(application, environment);
        }
        if (expression instanceof LambdaExpression lambda) {
            return new Closure(lambda.parameter(), lambda.body(), environment, this);
        }
        if (expression instanceof ListLiteral list) {
            List<LimeValue> elements = new ArrayList<>(list.elements().size());
            for (LimeExpression element : list.elements()) {
                elements.add(evaluate(element, environment));
            }
            return new ListValue(elements);
        }
        if (expression instanceof BindingExpression binding) {
            throw new LimeEvaluationException(Kind.PARSE,
                    "binding of `" + binding.name() + "` is only allowed at top level");
        }
        throw new IllegalStateException("Unknown expression: " + expression);
    }

    private LimeValue evaluateApplication(ApplicationExpr application, Environment environment) {
        LimeValue function = evaluate(application.function(), environment);
        if (!(function instanceof FunctionValue callable)) {
            throw new LimeEvaluationException(Kind.NOT_CALLABLE,
                    "unable to call a value of type " + function.kindName());
        }
        return callable.apply(argumentThunk(application.argument(), environment));
    }

    /**
     * Wraps an argument for a call made from {@code environment}.
     * Literals need no deferral, and a bound identifier shares the thunk it is
     * already bound to so its cached value is reused.
     */
    private Thunk argumentThunk(LimeExpression argument, Environment environment) {
        if (argument instanceof LiteralExpr literal) {
            return Thunk.of(literalValue(literal));
        }
        if (argument instanceof VariableExpr variable) {
            Optional<Thunk> bound = environment.lookup(variable.name());
            if (bound.isPresent()) {
                return bound.get();
            }
        }
        return Thunk.deferred(argument, environment, this);
    }

    private static LimeValue literalValue(LiteralExpr literal) {
        return switch (literal.type()) {
            case NUMBER -> NumberValue.of((Double) literal.value());
            case STRING -> StringValue.of((String) literal.value());
            case NONE -> NoneValue.INSTANCE;
        };
    }
}
