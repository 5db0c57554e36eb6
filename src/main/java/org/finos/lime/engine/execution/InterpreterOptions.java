package org.finos.lime.engine.execution;

import java.io.PrintStream;
import java.util.Map;

/**
 * Interpreter configuration.
 *
 * Environment variables:
 * - LIME_CONTINUE_ON_ERROR: "true" to report a failing statement and go on
 *   with the next line (default: stop at the first error)
 * - LIME_ECHO_NONE: "true" to also print statement results that are ()
 * - LIME_STACK_SIZE: stack size in bytes for the evaluation thread
 *
 * @param continueOnError keep running after a non-fatal statement error
 * @param echoNone        print () results of expression statements
 * @param stackSize       evaluation thread stack size in bytes
 */
public record InterpreterOptions(
        boolean continueOnError,
        boolean echoNone,
        long stackSize) {

    public static final long DEFAULT_STACK_SIZE = 512L * 1024 * 1024;

    public InterpreterOptions {
        if (stackSize <= 0) {
            throw new IllegalArgumentException("Stack size must be positive: " + stackSize);
        }
    }

    public static InterpreterOptions defaults() {
        return new InterpreterOptions(false, false, DEFAULT_STACK_SIZE);
    }

    /**
     * Reads the options from environment variables, keeping the default for
     * anything unset or invalid. Invalid values are reported on {@code warnings}.
     */
    public static InterpreterOptions fromEnvironment(Map<String, String> env, PrintStream warnings) {
        InterpreterOptions defaults = defaults();
        boolean continueOnError = flag(env, "LIME_CONTINUE_ON_ERROR", defaults.continueOnError(), warnings);
        boolean echoNone = flag(env, "LIME_ECHO_NONE", defaults.echoNone(), warnings);

        long stackSize = defaults.stackSize();
        String envStack = env.get("LIME_STACK_SIZE");
        if (envStack != null && !envStack.isBlank()) {
            try {
                stackSize = parseStackSize(envStack);
            } catch (IllegalArgumentException e) {
                warnings.println("Invalid LIME_STACK_SIZE env var: " + envStack);
            }
        }
        return new InterpreterOptions(continueOnError, echoNone, stackSize);
    }

    public InterpreterOptions withContinueOnError(boolean value) {
        return new InterpreterOptions(value, echoNone, stackSize);
    }

    public InterpreterOptions withEchoNone(boolean value) {
        return new InterpreterOptions(continueOnError, value, stackSize);
    }

    public InterpreterOptions withStackSize(long value) {
        return new InterpreterOptions(continueOnError, echoNone, value);
    }

    /**
     * Parses a byte count with an optional k/m/g suffix, e.g. "256m".
     *
     * @throws IllegalArgumentException if the text is not a positive size
     */
    public static long parseStackSize(String text) {
        String value = text.strip().toLowerCase();
        long multiplier = 1;
        if (!value.isEmpty()) {
            char suffix = value.charAt(value.length() - 1);
            multiplier = switch (suffix) {
                case 'k' -> 1024L;
                case 'm' -> 1024L * 1024;
                case 'g' -> 1024L * 1024 * 1024;
                default -> 1L;
            };
            if (multiplier != 1) {
                value = value.substring(0, value.length() - 1);
            }
        }
        long size;
        try {
            size = Long.parseLong(value) * multiplier;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid stack size: " + text, e);
        }
        if (size <= 0) {
            throw new IllegalArgumentException("Stack size must be positive: " + text);
        }
        return size;
    }

    private static boolean flag(Map<String, String> env, String name, boolean fallback, PrintStream warnings) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return switch (value.strip().toLowerCase()) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> {
                warnings.println("Invalid " + name + " env var: " + value);
                yield fallback;
            }
        };
    }
}
