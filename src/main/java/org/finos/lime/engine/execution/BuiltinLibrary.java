package org.finos.lime.engine.execution;

import org.finos.lime.dsl.LimeException.Kind;
import org.finos.lime.engine.runtime.BuiltinFunction;
import org.finos.lime.engine.runtime.Environment;
import org.finos.lime.engine.runtime.LimeEvaluationException;
import org.finos.lime.engine.runtime.LimeValue;
import org.finos.lime.engine.runtime.ListValue;
import org.finos.lime.engine.runtime.NoneValue;
import org.finos.lime.engine.runtime.NumberValue;
import org.finos.lime.engine.runtime.StringValue;
import org.finos.lime.engine.runtime.Thunk;
import org.finos.lime.engine.runtime.ValueComparison;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.DoubleBinaryOperator;
import java.util.regex.Pattern;

/**
 * The native functions every Lime program starts with.
 *
 * Arithmetic, comparison, string and list operations, casts and console I/O.
 * The comparison builtins take their two branches unevaluated and force only
 * the one selected, which is how conditionals work in the language.
 */
public final class BuiltinLibrary {

    private static final Pattern NUMBER_TEXT = Pattern.compile(
            "[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final BufferedReader input;
    private final PrintStream output;
    private final Map<String, BuiltinFunction> builtins = new LinkedHashMap<>();

    public BuiltinLibrary(BufferedReader input, PrintStream output) {
        this.input = Objects.requireNonNull(input, "Input cannot be null");
        this.output = Objects.requireNonNull(output, "Output cannot be null");
        registerBuiltins();
    }

    /**
     * Binds every builtin in the given top-level frame.
     */
    public void install(Environment topLevel) {
        builtins.forEach((name, builtin) -> topLevel.define(name, Thunk.of(builtin)));
    }

    public Optional<BuiltinFunction> getBuiltin(String name) {
        return Optional.ofNullable(builtins.get(name));
    }

    public Collection<BuiltinFunction> builtins() {
        return Collections.unmodifiableCollection(builtins.values());
    }

    private void registerBuiltins() {
        // Arithmetic
        arithmetic("+", (a, b) -> a + b);
        arithmetic("-", (a, b) -> a - b);
        arithmetic("*", (a, b) -> a * b);
        register("/", 2, args -> {
            double dividend = number("/", args.get(0));
            double divisor = number("/", args.get(1));
            if (divisor == 0) {
                throw new LimeEvaluationException(Kind.DIVISION_BY_ZERO, "division by zero");
            }
            return NumberValue.of(dividend / divisor);
        });
        register("%", 2, args -> {
            double dividend = number("%", args.get(0));
            double divisor = number("%", args.get(1));
            if (divisor == 0) {
                throw new LimeEvaluationException(Kind.DIVISION_BY_ZERO, "modulo by zero");
            }
            return NumberValue.of(flooredModulo(dividend, divisor));
        });

        // Comparison (lazy in the branches)
        comparison("=", ValueComparison::equal);
        comparison("<", ValueComparison::lessThan);
        comparison(">", ValueComparison::greaterThan);

        // Strings and lists
        register("cat", 2, args -> StringValue.of(string("cat", args.get(0)) + string("cat", args.get(1))));
        register("at", 2, this::at);
        register("join", 2, this::join);
        register("len", 1, args -> {
            LimeValue value = args.get(0).force();
            if (value instanceof StringValue s) {
                return NumberValue.of(s.length());
            }
            if (value instanceof ListValue list) {
                return NumberValue.of(list.size());
            }
            throw LimeEvaluationException.typeMismatch("len", "a string or list", value);
        });

        // Casts
        register("num", 1, args -> parseNumber(string("num", args.get(0))));
        register("str", 1, args -> StringValue.of(NumberValue.format(number("str", args.get(0)))));

        // I/O and sequencing
        register("get", 1, this::get);
        register("print", 1, args -> {
            output.println(args.get(0).force().display());
            output.flush();
            return NoneValue.INSTANCE;
        });
        register("do", 2, args -> {
            args.get(0).force();
            return args.get(1).force();
        });
    }

    private void register(String name, int arity, BuiltinFunction.Implementation implementation) {
        builtins.put(name, new BuiltinFunction(name, arity, implementation));
    }

    private void arithmetic(String name, DoubleBinaryOperator operator) {
        register(name, 2, args -> NumberValue.of(
                operator.applyAsDouble(number(name, args.get(0)), number(name, args.get(1)))));
    }

    private void comparison(String name, BiPredicate<LimeValue, LimeValue> test) {
        register(name, 4, args -> {
            boolean holds = test.test(args.get(0).force(), args.get(1).force());
            return holds ? args.get(2).force() : args.get(3).force();
        });
    }

    private LimeValue at(List<Thunk> args) {
        LimeValue sequence = args.get(0).force();
        if (!(sequence instanceof StringValue) && !(sequence instanceof ListValue)) {
            throw LimeEvaluationException.typeMismatch("at", "a string or list", sequence);
        }
        LimeValue indexValue = args.get(1).force();
        if (!(indexValue instanceof NumberValue index)) {
            throw LimeEvaluationException.typeMismatch("at", "a number index", indexValue);
        }
        if (!index.isIntegral()) {
            throw new LimeEvaluationException(Kind.TYPE,
                    "`at` expected an integer index; received " + index.display());
        }

        int position = (int) index.value();
        int length = sequence instanceof StringValue s ? s.length() : ((ListValue) sequence).size();
        if (position < 0 || position >= length) {
            throw new LimeEvaluationException(Kind.INDEX_OUT_OF_RANGE,
                    "index " + position + " is out of range for " + sequence.kindName() + " of length " + length);
        }
        if (sequence instanceof StringValue s) {
            return s.codePointAt(position);
        }
        return ((ListValue) sequence).elements().get(position);
    }

    private LimeValue join(List<Thunk> args) {
        LimeValue first = args.get(0).force();
        if (first instanceof StringValue s) {
            return StringValue.of(s.value() + string("join", args.get(1)));
        }
        if (first instanceof ListValue left) {
            LimeValue second = args.get(1).force();
            if (!(second instanceof ListValue right)) {
                throw LimeEvaluationException.typeMismatch("join", "a list", second);
            }
            List<LimeValue> joined = new ArrayList<>(left.size() + right.size());
            joined.addAll(left.elements());
            joined.addAll(right.elements());
            return new ListValue(joined);
        }
        throw LimeEvaluationException.typeMismatch("join", "a list or string", first);
    }

    private LimeValue get(List<Thunk> args) {
        LimeValue argument = args.get(0).force();
        if (!(argument instanceof NoneValue)) {
            throw LimeEvaluationException.typeMismatch("get", "()", argument);
        }
        output.flush();
        try {
            String line = input.readLine();
            if (line == null) {
                throw new LimeEvaluationException(Kind.IO, "end of input reached by `get`");
            }
            return StringValue.of(line);
        } catch (IOException e) {
            throw new LimeEvaluationException(Kind.IO, "unable to read input: " + e.getMessage(), e);
        }
    }

    static NumberValue parseNumber(String text) {
        String trimmed = text.strip();
        if (!NUMBER_TEXT.matcher(trimmed).matches()) {
            throw new LimeEvaluationException(Kind.NUMBER_PARSE,
                    "could not convert string to number: \"" + text + "\"");
        }
        return NumberValue.of(Double.parseDouble(trimmed));
    }

    static double flooredModulo(double dividend, double divisor) {
        double remainder = dividend % divisor;
        if (remainder != 0 && (remainder < 0) != (divisor < 0)) {
            remainder += divisor;
        }
        return remainder;
    }

    private static double number(String function, Thunk argument) {
        LimeValue value = argument.force();
        if (value instanceof NumberValue n) {
            return n.value();
        }
        throw LimeEvaluationException.typeMismatch(function, "a number", value);
    }

    private static String string(String function, Thunk argument) {
        LimeValue value = argument.force();
        if (value instanceof StringValue s) {
            return s.value();
        }
        throw LimeEvaluationException.typeMismatch(function, "a string", value);
    }
}
