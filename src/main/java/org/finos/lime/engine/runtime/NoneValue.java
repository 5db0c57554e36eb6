package org.finos.lime.engine.runtime;

/**
 * The unit value, written {@code ()}.
 */
public enum NoneValue implements LimeValue {
    INSTANCE;

    @Override
    public String kindName() {
        return "none";
    }

    @Override
    public String display() {
        return "()";
    }
}
