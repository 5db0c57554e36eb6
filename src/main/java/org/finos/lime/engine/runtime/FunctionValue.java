package org.finos.lime.engine.runtime;

/**
 * A value that can be applied to one argument.
 * Multi-argument functions are curried: applying returns another function
 * until the last argument is supplied.
 */
public sealed interface FunctionValue extends LimeValue permits Closure, BuiltinFunction {

    /**
     * Applies the function to an argument that has not been evaluated yet.
     */
    LimeValue apply(Thunk argument);

    @Override
    default String kindName() {
        return "function";
    }
}
