package org.finos.lime.engine.runtime;

import org.finos.lime.dsl.LimeExpression;

/**
 * Evaluates an expression in an environment. Thunks and closures hold one of
 * these so they can run their deferred code.
 */
@FunctionalInterface
public interface ExpressionEvaluator {

    LimeValue evaluate(LimeExpression expression, Environment environment);
}
