package org.finos.lime.engine.runtime;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A frame in the chain of lexical scopes.
 *
 * The top-level frame is the only mutable one: top-level bindings are
 * added or replaced in place. Frames made by applying a closure hold a single
 * binding and never change, and so do snapshots of the top level. Frames only
 * point at their parent.
 */
public final class Environment {

    private final Environment parent;
    private final Map<String, Thunk> bindings;
    private final boolean mutable;

    private Environment(Environment parent, Map<String, Thunk> bindings, boolean mutable) {
        this.parent = parent;
        this.bindings = bindings;
        this.mutable = mutable;
    }

    /**
     * Creates an empty, mutable top-level frame.
     */
    public static Environment topLevel() {
        return new Environment(null, new HashMap<>(), true);
    }

    /**
     * Creates an immutable child frame binding one name.
     */
    public Environment extend(String name, Thunk value) {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        return new Environment(this, Collections.singletonMap(name, value), false);
    }

    /**
     * Copies the current bindings of the top-level frame into an immutable
     * frame. Later definitions and rebindings are not visible through it.
     */
    public Environment snapshot() {
        if (!mutable) {
            throw new IllegalStateException("Only the top-level frame can be snapshot");
        }
        return new Environment(null, Map.copyOf(bindings), false);
    }

    /**
     * Binds or rebinds a name in this frame. Only valid on the top-level frame.
     */
    public void define(String name, Thunk value) {
        if (!mutable) {
            throw new IllegalStateException("Cannot define '" + name + "' in a call frame");
        }
        bindings.put(Objects.requireNonNull(name, "Name cannot be null"),
                Objects.requireNonNull(value, "Value cannot be null"));
    }

    /**
     * Finds the binding for {@code name}, innermost frame first.
     * Does not force anything.
     */
    public Optional<Thunk> lookup(String name) {
        for (Environment frame = this; frame != null; frame = frame.parent) {
            Thunk thunk = frame.bindings.get(name);
            if (thunk != null) {
                return Optional.of(thunk);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up and forces {@code name}.
     *
     * @throws LimeEvaluationException if the name is not bound in any frame
     */
    public LimeValue resolve(String name) {
        return lookup(name)
                .orElseThrow(() -> LimeEvaluationException.unbound(name))
                .force();
    }

    public boolean isTopLevel() {
        return mutable;
    }

    /**
     * Names visible from this frame, sorted.
     */
    public Set<String> names() {
        Set<String> names = new TreeSet<>();
        for (Environment frame = this; frame != null; frame = frame.parent) {
            names.addAll(frame.bindings.keySet());
        }
        return names;
    }
}
