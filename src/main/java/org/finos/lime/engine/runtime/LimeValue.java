package org.finos.lime.engine.runtime;

/**
 * Runtime value produced by evaluating a Lime expression.
 *
 * Closed over the five kinds of value the language has. Values are
 * immutable and can be shared freely once produced.
 */
public sealed interface LimeValue
        permits NumberValue, StringValue, ListValue, NoneValue, FunctionValue {

    /**
     * Name of the value's kind as used in type error messages.
     */
    String kindName();

    /**
     * The text printed for this value by the driver and by {@code print}.
     */
    String display();
}
