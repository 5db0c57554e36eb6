package org.finos.lime.engine.runtime;

import org.finos.lime.dsl.LimeException.Kind;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the scope chain.
 */
class EnvironmentTest {

    @Test
    void lookupWalksOutward() {
        Environment top = Environment.topLevel();
        top.define("a", Thunk.of(NumberValue.of(1)));
        Environment inner = top.extend("b", Thunk.of(NumberValue.of(2))).extend("c", Thunk.of(NumberValue.of(3)));

        assertEquals(NumberValue.of(1), inner.resolve("a"));
        assertEquals(NumberValue.of(2), inner.resolve("b"));
        assertEquals(NumberValue.of(3), inner.resolve("c"));
        assertTrue(top.lookup("b").isEmpty());
    }

    @Test
    void innerBindingShadowsOuter() {
        Environment top = Environment.topLevel();
        top.define("x", Thunk.of(NumberValue.of(1)));
        Environment inner = top.extend("x", Thunk.of(NumberValue.of(2)));

        assertEquals(NumberValue.of(2), inner.resolve("x"));
        assertEquals(NumberValue.of(1), top.resolve("x"));
    }

    @Test
    void rebindingReplacesTopLevelEntry() {
        Environment top = Environment.topLevel();
        top.define("x", Thunk.of(NumberValue.of(1)));
        Environment inner = top.extend("y", Thunk.of(NoneValue.INSTANCE));
        top.define("x", Thunk.of(NumberValue.of(5)));

        assertEquals(NumberValue.of(5), inner.resolve("x"));
    }

    @Test
    void snapshotIgnoresLaterDefinitions() {
        Environment top = Environment.topLevel();
        top.define("x", Thunk.of(NumberValue.of(1)));
        Environment snapshot = top.snapshot();
        top.define("x", Thunk.of(NumberValue.of(2)));
        top.define("y", Thunk.of(NumberValue.of(3)));

        assertEquals(NumberValue.of(1), snapshot.resolve("x"));
        assertTrue(snapshot.lookup("y").isEmpty());
        assertEquals(NumberValue.of(2), top.resolve("x"));
        assertFalse(snapshot.isTopLevel());
        assertThrows(IllegalStateException.class, () -> snapshot.define("z", Thunk.of(NoneValue.INSTANCE)));
        assertThrows(IllegalStateException.class, snapshot::snapshot);
    }

    @Test
    void callFramesAreImmutable() {
        Environment frame = Environment.topLevel().extend("x", Thunk.of(NoneValue.INSTANCE));
        assertFalse(frame.isTopLevel());
        assertThrows(IllegalStateException.class, () -> frame.define("y", Thunk.of(NoneValue.INSTANCE)));
    }

    @Test
    void unboundName() {
        LimeEvaluationException e = assertThrows(LimeEvaluationException.class,
                () -> Environment.topLevel().resolve("missing"));
        assertEquals(Kind.UNBOUND_IDENTIFIER, e.getKind());
        assertTrue(e.getMessage().contains("`missing` is not defined"));
    }

    @Test
    void lookupDoesNotForce() {
        Environment top = Environment.topLevel();
        Thunk pending = Thunk.deferred(new org.finos.lime.dsl.VariableExpr("y"), top,
                (expr, env) -> { throw new AssertionError("forced"); });
        top.define("x", pending);

        assertSame(pending, top.lookup("x").orElseThrow());
        assertFalse(pending.isForced());
    }

    @Test
    void namesIncludeEveryFrame() {
        Environment top = Environment.topLevel();
        top.define("b", Thunk.of(NoneValue.INSTANCE));
        Environment inner = top.extend("a", Thunk.of(NoneValue.INSTANCE));
        assertEquals(Set.of("a", "b"), inner.names());
    }
}
