package org.finos.lime.engine.cli;

import org.finos.lime.engine.execution.ExecutionSummary;
import org.finos.lime.engine.execution.InterpreterOptions;
import org.finos.lime.engine.execution.LimeInterpreter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Command line entry point.
 *
 * Run with:
 * java -jar lime.jar [--continue-on-error] [--echo-none] [--stack-size BYTES] program.lime
 *
 * Exit status: 0 on success, 1 if the program raised an error, 2 for usage
 * errors or an unreadable file.
 */
public final class LimeMain {

    static final int EXIT_OK = 0;
    static final int EXIT_PROGRAM_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "usage: lime [--continue-on-error] [--echo-none] [--stack-size BYTES] FILE";

    private LimeMain() {
    }

    public static void main(String[] args) {
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int status = run(args, System.getenv(), stdin, System.out, System.err);
        System.exit(status);
    }

    /**
     * Parses the arguments, runs the program and returns the exit status.
     */
    static int run(String[] args, Map<String, String> env, BufferedReader stdin, PrintStream out, PrintStream err) {
        InterpreterOptions options = InterpreterOptions.fromEnvironment(env, err);
        String file = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-k", "--continue-on-error" -> options = options.withContinueOnError(true);
                case "--echo-none" -> options = options.withEchoNone(true);
                case "--stack-size" -> {
                    if (i + 1 >= args.length) {
                        err.println("missing value for --stack-size");
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    try {
                        options = options.withStackSize(InterpreterOptions.parseStackSize(args[++i]));
                    } catch (IllegalArgumentException e) {
                        err.println(e.getMessage());
                        return EXIT_USAGE;
                    }
                }
                default -> {
                    if (arg.startsWith("-") || file != null) {
                        err.println("lime requires exactly one argument: a file name");
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    file = arg;
                }
            }
        }

        if (file == null) {
            err.println("lime requires exactly one argument: a file name");
            err.println(USAGE);
            return EXIT_USAGE;
        }

        Path path = Path.of(file);
        if (!Files.isReadable(path)) {
            err.println("unable to open file: `" + file + "`");
            return EXIT_USAGE;
        }

        LimeInterpreter interpreter = new LimeInterpreter(stdin, out, err, options);
        return runOnLargeStack(interpreter, path, options.stackSize(), err);
    }

    /**
     * Deep recursion in Lime programs turns into deep Java recursion, so the
     * program runs on its own thread with the configured stack size.
     */
    private static int runOnLargeStack(LimeInterpreter interpreter, Path path, long stackSize, PrintStream err) {
        AtomicInteger status = new AtomicInteger(EXIT_USAGE);
        Thread worker = new Thread(null, () -> {
            try {
                ExecutionSummary summary = interpreter.run(path);
                status.set(summary.exitCode());
            } catch (NoSuchFileException e) {
                err.println("unable to open file: `" + path + "`");
            } catch (IOException e) {
                err.println("unable to read file: `" + path + "`: " + e.getMessage());
            } catch (RuntimeException e) {
                err.println("internal error: " + e);
                status.set(EXIT_PROGRAM_ERROR);
            }
        }, "lime-main", stackSize);

        worker.start();
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("interrupted");
            return EXIT_PROGRAM_ERROR;
        }
        return status.get();
    }
}
