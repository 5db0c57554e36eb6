package org.finos.lime.engine.runtime;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, immutable sequence of values.
 */
public record ListValue(List<LimeValue> elements) implements LimeValue {

    public ListValue {
        elements = List.copyOf(elements);
    }

    public static ListValue of(LimeValue... elements) {
        return new ListValue(List.of(elements));
    }

    public int size() {
        return elements.size();
    }

    @Override
    public String kindName() {
        return "list";
    }

    @Override
    public String display() {
        return elements.stream()
                .map(LimeValue::display)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
