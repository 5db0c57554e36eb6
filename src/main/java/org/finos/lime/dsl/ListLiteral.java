package org.finos.lime.dsl;

import java.util.List;

/**
 * List literal: [expr1, expr2, ...]
 */
public record ListLiteral(List<LimeExpression> elements) implements LimeExpression {

    public ListLiteral {
        elements = List.copyOf(elements);
    }
}
