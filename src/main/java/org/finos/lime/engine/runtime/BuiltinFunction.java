package org.finos.lime.engine.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A native function of fixed arity.
 *
 * Each application collects one unevaluated argument. Once all arguments
 * are present the implementation runs; it decides which thunks to force.
 */
public final class BuiltinFunction implements FunctionValue {

    /**
     * Native body of a builtin. Receives exactly {@code arity} thunks.
     */
    @FunctionalInterface
    public interface Implementation {
        LimeValue invoke(List<Thunk> arguments);
    }

    private final String name;
    private final int arity;
    private final Implementation implementation;
    private final List<Thunk> collected;

    public BuiltinFunction(String name, int arity, Implementation implementation) {
        this(name, arity, implementation, List.of());
    }

    private BuiltinFunction(String name, int arity, Implementation implementation, List<Thunk> collected) {
        if (arity < 1) {
            throw new IllegalArgumentException("Builtin arity must be at least 1: " + name);
        }
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.arity = arity;
        this.implementation = Objects.requireNonNull(implementation, "Implementation cannot be null");
        this.collected = collected;
    }

    @Override
    public LimeValue apply(Thunk argument) {
        List<Thunk> arguments = new ArrayList<>(collected.size() + 1);
        arguments.addAll(collected);
        arguments.add(argument);
        if (arguments.size() < arity) {
            return new BuiltinFunction(name, arity, implementation, List.copyOf(arguments));
        }
        return implementation.invoke(List.copyOf(arguments));
    }

    public String name() {
        return name;
    }

    public int arity() {
        return arity;
    }

    @Override
    public String display() {
        return "<builtin " + name + ">";
    }

    @Override
    public String toString() {
        return display();
    }
}
