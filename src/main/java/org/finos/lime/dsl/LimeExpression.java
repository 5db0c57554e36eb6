package org.finos.lime.dsl;

/**
 * Sealed interface representing expressions in the Lime AST.
 *
 * Type hierarchy:
 * LimeExpression
 * ├── LiteralExpr (numbers, strings, none)
 * ├── ListLiteral ([a, b, c])
 * ├── VariableExpr (identifier reference)
 * ├── LambdaExpression (single-parameter function)
 * ├── ApplicationExpr (single-argument call)
 * └── BindingExpression (top-level name := expr)
 *
 * Trees are immutable and may be evaluated any number of times.
 */
public sealed interface LimeExpression
        permits LiteralExpr, ListLiteral, VariableExpr,
        LambdaExpression, ApplicationExpr, BindingExpression {
}
