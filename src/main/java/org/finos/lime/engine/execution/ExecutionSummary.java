package org.finos.lime.engine.execution;

import org.finos.lime.dsl.LimeException;

import java.util.List;

/**
 * Outcome of running a whole program.
 *
 * @param linesExecuted      lines that completed without error, blank lines included
 * @param errors             errors reported, in source order
 * @param aborted            true if the run stopped before the end of the source
 */
public record ExecutionSummary(
        int linesExecuted,
        List<LimeException> errors,
        boolean aborted) {

    public ExecutionSummary {
        errors = List.copyOf(errors);
    }

    public boolean succeeded() {
        return errors.isEmpty();
    }

    /**
     * Process exit status: 0 on success, 1 if any statement failed.
     */
    public int exitCode() {
        return succeeded() ? 0 : 1;
    }
}
