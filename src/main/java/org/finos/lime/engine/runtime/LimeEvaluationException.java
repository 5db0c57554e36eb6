package org.finos.lime.engine.runtime;

import org.finos.lime.dsl.LimeException;

/**
 * Exception thrown when evaluating a Lime expression fails.
 */
public class LimeEvaluationException extends LimeException {

    public LimeEvaluationException(Kind kind, String message) {
        super(kind, message);
    }

    public LimeEvaluationException(Kind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public static LimeEvaluationException unbound(String name) {
        return new LimeEvaluationException(Kind.UNBOUND_IDENTIFIER, "`" + name + "` is not defined");
    }

    public static LimeEvaluationException typeMismatch(String function, String expected, LimeValue received) {
        return new LimeEvaluationException(Kind.TYPE,
                "`" + function + "` expected " + expected + "; received " + received.kindName());
    }
}
