package org.finos.lime.engine.execution;

import org.finos.lime.dsl.LimeException;
import org.finos.lime.dsl.LimeException.Kind;
import org.finos.lime.dsl.LimeExpression;
import org.finos.lime.dsl.LimeParser;
import org.finos.lime.engine.runtime.Environment;
import org.finos.lime.engine.runtime.LimeEvaluationException;
import org.finos.lime.engine.runtime.LimeValue;
import org.finos.lime.engine.runtime.NoneValue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs Lime programs one line at a time against a single top-level environment.
 *
 * Each instance owns its own top-level frame, so several interpreters can run
 * side by side without sharing bindings.
 *
 * Usage:
 * <pre>
 * LimeInterpreter interpreter = new LimeInterpreter(input, System.out, System.err, InterpreterOptions.defaults());
 * ExecutionSummary summary = interpreter.run(Path.of("program.lime"));
 * </pre>
 */
public final class LimeInterpreter {

    private final Environment topLevel = Environment.topLevel();
    private final LimeEvaluator evaluator = new LimeEvaluator();
    private final PrintStream output;
    private final PrintStream errors;
    private final InterpreterOptions options;
    private int nextLine = 1;

    public LimeInterpreter(BufferedReader input, PrintStream output, PrintStream errors, InterpreterOptions options) {
        this.output = Objects.requireNonNull(output, "Output cannot be null");
        this.errors = Objects.requireNonNull(errors, "Errors cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        new BuiltinLibrary(input, output).install(topLevel);
    }

    /**
     * Executes a single statement as the next line of the session.
     */
    public Optional<LimeValue> execute(String line) {
        return execute(line, nextLine++);
    }

    /**
     * Lexes, parses and evaluates one source line.
     *
     * @param line       The source text of the statement
     * @param lineNumber The line number reported in errors
     * @return The value of an expression statement; empty for bindings and
     *         blank or comment-only lines
     * @throws LimeException for any lex, parse or evaluation error
     */
    public Optional<LimeValue> execute(String line, int lineNumber) {
        try {
            Optional<LimeExpression> statement = LimeParser.parse(line, lineNumber);
            if (statement.isEmpty()) {
                return Optional.empty();
            }
            return evaluator.execute(statement.get(), topLevel);
        } catch (LimeException e) {
            throw e.locate(lineNumber);
        } catch (StackOverflowError e) {
            throw new LimeEvaluationException(Kind.RECURSION_LIMIT_EXCEEDED, "maximum recursion depth exceeded")
                    .locate(lineNumber);
        }
    }

    /**
     * Runs a UTF-8 source file.
     */
    public ExecutionSummary run(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return run(reader);
        }
    }

    /**
     * Runs a whole program, printing the value of every expression statement.
     *
     * Errors are written to the error stream. The run stops at the first error
     * unless {@link InterpreterOptions#continueOnError()} is set; fatal errors
     * always stop it.
     */
    public ExecutionSummary run(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        List<LimeException> failures = new ArrayList<>();
        int executed = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            int lineNumber = nextLine++;
            try {
                Optional<LimeValue> result = execute(line, lineNumber);
                result.filter(value -> options.echoNone() || value != NoneValue.INSTANCE)
                        .ifPresent(value -> output.println(value.display()));
                executed++;
            } catch (LimeException e) {
                errors.println(e.getMessage());
                failures.add(e);
                if (e.isFatal() || !options.continueOnError()) {
                    output.flush();
                    return new ExecutionSummary(executed, failures, true);
                }
            }
        }

        output.flush();
        return new ExecutionSummary(executed, failures, false);
    }
}
