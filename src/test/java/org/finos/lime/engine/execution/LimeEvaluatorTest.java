package org.finos.lime.engine.execution;

import org.finos.lime.dsl.LimeException;
import org.finos.lime.dsl.LimeException.Kind;
import org.finos.lime.dsl.LimeParser;
import org.finos.lime.engine.runtime.Closure;
import org.finos.lime.engine.runtime.Environment;
import org.finos.lime.engine.runtime.LimeValue;
import org.finos.lime.engine.runtime.ListValue;
import org.finos.lime.engine.runtime.NoneValue;
import org.finos.lime.engine.runtime.NumberValue;
import org.finos.lime.engine.runtime.StringValue;
import org.finos.lime.engine.runtime.Thunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for call-by-need evaluation, closures and currying.
 */
class LimeEvaluatorTest {

    private ByteArrayOutputStream out;
    private LimeInterpreter interpreter;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        PrintStream printStream = new PrintStream(out, true, StandardCharsets.UTF_8);
        interpreter = new LimeInterpreter(new BufferedReader(new StringReader("")),
                printStream, printStream, InterpreterOptions.defaults());
    }

    private LimeValue eval(String line) {
        return interpreter.execute(line).orElseThrow();
    }

    private void define(String... lines) {
        for (String line : lines) {
            assertEquals(Optional.empty(), interpreter.execute(line));
        }
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private LimeException failure(String line) {
        return assertThrows(LimeException.class, () -> interpreter.execute(line));
    }

    @Nested
    @DisplayName("Lambdas and application")
    class ApplicationTests {

        @Test
        void literals() {
            assertEquals(NumberValue.of(42), eval("42"));
            assertEquals(StringValue.of("lime"), eval("\"lime\""));
            assertSame(NoneValue.INSTANCE, eval("()"));
        }

        @Test
        @DisplayName("(\\a.\\b.a) 5 4 selects the first argument")
        void constFunction() {
            assertEquals(NumberValue.of(5), eval("(\\a.\\b.a) 5 4"));
            assertEquals(NumberValue.of(4), eval("(\\a.\\b.b) 5 4"));
        }

        @Test
        void innerParameterShadowsOuter() {
            assertEquals(NumberValue.of(2), eval("(\\x.(\\x.x) 2) 1"));
        }

        @Test
        @DisplayName("Arguments are captured in the caller's scope")
        void captureIsLexical() {
            define("y := 7");
            // the argument y refers to the top-level y, not the lambda's own y
            assertEquals(NumberValue.of(7), eval("(\\x.\\y.x) y 3"));
        }

        @Test
        void closuresRememberTheirEnvironment() {
            define("adder := \\n.\\m.+ n m", "add10 := adder 10");
            assertEquals(NumberValue.of(15), eval("add10 5"));
            assertEquals(NumberValue.of(11), eval("add10 1"));
        }

        @Test
        void applyingNonFunction() {
            LimeException e = failure("5 3");
            assertEquals(Kind.NOT_CALLABLE, e.getKind());
            assertTrue(e.getMessage().contains("unable to call a value of type number"), e.getMessage());
            assertEquals(Kind.NOT_CALLABLE, failure("\"s\" 1").getKind());
        }

        @Test
        void ignoredParameter() {
            assertEquals(StringValue.of("k"), eval("(\\.\"k\") (/ 1 0)"));
        }

        @Test
        void listElementsAreEvaluated() {
            define("double := \\x.* x 2");
            assertEquals(ListValue.of(NumberValue.of(2), StringValue.of("a"), ListValue.of(NumberValue.of(6))),
                    eval("[double 1, \"a\", [double 3]]"));
        }

        @Test
        void listsCanHoldFunctions() {
            define("fs := [\\x.+ x 1, \\x.* x 10]");
            assertEquals(NumberValue.of(30), eval("(at fs 1) 3"));
        }
    }

    @Nested
    @DisplayName("Currying")
    class CurryingTests {

        @Test
        @DisplayName("Partial application yields an unreduced closure")
        void partialApplicationIsClosure() {
            define("f := \\s.cat s \"!\"", "g := \"hi\"");
            LimeValue partial = eval("(\\a.\\b.a b) f");
            assertInstanceOf(Closure.class, partial);
            assertEquals("b", ((Closure) partial).parameter());

            define("h := (\\a.\\b.a b) f");
            assertEquals(eval("f g"), eval("h g"));
            assertEquals(StringValue.of("hi!"), eval("h g"));
        }

        @Test
        void partialBuiltin() {
            define("inc := + 1");
            assertEquals("<builtin +>", eval("inc").display());
            assertEquals(NumberValue.of(3), eval("inc 2"));
            assertEquals(NumberValue.of(10), eval("inc 9"));
        }

        @Test
        void builtinsPassAsArguments() {
            define("flip := \\f.\\a.\\b.f b a");
            assertEquals(NumberValue.of(-3), eval("flip - 5 2"));
            assertEquals(StringValue.of("ba"), eval("flip cat \"a\" \"b\""));
        }
    }

    @Nested
    @DisplayName("Laziness")
    class LazinessTests {

        @Test
        @DisplayName("Only the selected branch of = is evaluated")
        void untakenBranchNeverForced() {
            assertSame(NoneValue.INSTANCE, eval("= 0 2 (print \"true\") (print \"false\")"));
            assertEquals("false" + System.lineSeparator(), output());
        }

        @Test
        void unusedArgumentIsNeverEvaluated() {
            assertEquals(NumberValue.of(5), eval("(\\x.5) (/ 1 0)"));
            assertEquals(NumberValue.of(5), eval("(\\x.5) not_defined_anywhere"));
            assertEquals("", output());
        }

        @Test
        @DisplayName("An argument forced twice runs its side effect once")
        void argumentIsMemoized() {
            define("twice := \\v.do v v");
            eval("twice (print \"hi\")");
            assertEquals("hi" + System.lineSeparator(), output());
        }

        @Test
        @DisplayName("A binding referenced twice is evaluated once")
        void bindingIsMemoized() {
            define("y := do (print \"side\") 42");
            assertEquals("", output());
            assertEquals(NumberValue.of(84), eval("+ y y"));
            assertEquals(NumberValue.of(42), eval("y"));
            assertEquals("side" + System.lineSeparator(), output());
        }

        @Test
        @DisplayName("Bindings are deferred: an unbound name fails only when forced")
        void bindingIsDeferred() {
            define("x := y");
            LimeException e = failure("x");
            assertEquals(Kind.UNBOUND_IDENTIFIER, e.getKind());
            assertTrue(e.getMessage().contains("`y` is not defined"), e.getMessage());
        }

        @Test
        @DisplayName("A binding does not see names defined after it")
        void bindingIgnoresLaterDefinitions() {
            define("x := + y 1", "y := 41");
            LimeException e = failure("x");
            assertEquals(Kind.UNBOUND_IDENTIFIER, e.getKind());
            assertTrue(e.getMessage().contains("`y` is not defined"), e.getMessage());
        }

        @Test
        void rebindingReplacesValue() {
            define("a := 1", "a := 2");
            assertEquals(NumberValue.of(2), eval("a"));
        }

        @Test
        @DisplayName("A binding keeps the value its names had when it was made")
        void bindingKeepsEarlierValue() {
            define("a := 1", "b := a", "a := 2");
            assertEquals(NumberValue.of(1), eval("b"));
            assertEquals(NumberValue.of(2), eval("a"));
        }

        @Test
        @DisplayName("x := + x 1 refers to the previous x")
        void rebindingInTermsOfOldValue() {
            define("x := 1", "x := + x 1");
            assertEquals(NumberValue.of(2), eval("x"));
            define("x := * x 10");
            assertEquals(NumberValue.of(20), eval("x"));
        }

        @Test
        void selfReferenceWithoutEarlierBindingIsUnbound() {
            define("z := + z 1");
            assertEquals(Kind.UNBOUND_IDENTIFIER, failure("z").getKind());
        }
    }

    @Nested
    @DisplayName("Recursion through self-application")
    class RecursionTests {

        @BeforeEach
        void defineFactorial() {
            define("fact_rec := \\f.\\n.= n 1 n (* n (f f (- n 1)))", "fact := fact_rec fact_rec");
        }

        @Test
        void factorial() {
            assertEquals(NumberValue.of(120), eval("fact 5"));
            assertEquals(NumberValue.of(1), eval("fact 1"));
            assertEquals(NumberValue.of(3628800), eval("fact 10"));
        }

        @Test
        void sumOfList() {
            define("sum_rec := \\f.\\l.\\i.= i (len l) 0 (+ (at l i) (f f l (+ i 1)))",
                    "sum := \\l.sum_rec sum_rec l 0");
            assertEquals(NumberValue.of(10), eval("sum [1, 2, 3, 4]"));
            assertEquals(NumberValue.of(0), eval("sum []"));
        }

        @Test
        void mapOverList() {
            define("tail_rec := \\r.\\l.\\i.\\acc.= i (len l) acc (r r l (+ i 1) (join acc [at l i]))",
                    "tail := \\l.tail_rec tail_rec l 1 []",
                    "map_rec := \\r.\\f.\\l.= l [] [] (join [f (at l 0)] (r r f (tail l)))",
                    "map := map_rec map_rec");
            assertEquals(ListValue.of(NumberValue.of(2), NumberValue.of(4), NumberValue.of(6)),
                    eval("map (\\x.* x 2) [1, 2, 3]"));
        }

        @Test
        @DisplayName("Unbounded recursion is reported as a recursion limit error")
        void unboundedRecursion() {
            define("loop := \\f.f f");
            LimeException e = failure("loop loop");
            assertEquals(Kind.RECURSION_LIMIT_EXCEEDED, e.getKind());
            assertTrue(e.isFatal());
        }
    }

    @Test
    @DisplayName("Separate interpreters do not share bindings")
    void interpretersAreIndependent() {
        define("shared := 1");
        LimeInterpreter other = new LimeInterpreter(new BufferedReader(new StringReader("")),
                System.out, System.err, InterpreterOptions.defaults());
        assertEquals(Kind.UNBOUND_IDENTIFIER,
                assertThrows(LimeException.class, () -> other.execute("shared")).getKind());
    }

    @Test
    void evaluatorExecutesAgainstTopLevelOnly() {
        LimeEvaluator evaluator = new LimeEvaluator();
        Environment top = Environment.topLevel();
        Environment frame = top.extend("x", Thunk.of(NoneValue.INSTANCE));
        assertThrows(IllegalArgumentException.class,
                () -> evaluator.execute(LimeParser.parseExpression("x"), frame));
        assertEquals(Optional.of(NoneValue.INSTANCE), evaluator.execute(LimeParser.parseExpression("()"), top));
    }
}
