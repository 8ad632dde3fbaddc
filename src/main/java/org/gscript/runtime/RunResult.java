package org.gscript.runtime;

import org.gscript.error.ScriptError;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of running a script: the lines it printed and the error that stopped it, if any.
 *
 * <p>Lines printed before a runtime error are kept. A lex or parse error means nothing ran.
 *
 * @param output lines printed by this run, in order
 * @param error  the failure that ended the run, empty on success
 * @param source the script source (for formatting diagnostics)
 */
public record RunResult(
    List<String> output,
    Optional<ScriptError> error,
    String source
) {
    public static RunResult success(List<String> output, String source) {
        return new RunResult(List.copyOf(output), Optional.empty(), source);
    }

    public static RunResult failure(List<String> output, ScriptError error, String source) {
        return new RunResult(List.copyOf(output), Optional.of(error), source);
    }

    public boolean isSuccess() {
        return error.isEmpty();
    }

    public boolean hasError() {
        return error.isPresent();
    }

    /**
     * Kind of the failure, if the run failed.
     */
    public Optional<ScriptError.Kind> errorKind() {
        return error.map(ScriptError::kind);
    }

    /**
     * Format the failure in Rust style, or return an empty string on success.
     *
     * @param filename Optional filename for display
     */
    public String formatDiagnostics(String filename) {
        return error.map(e -> e.toDiagnostic().format(source, filename))
                    .orElse("");
    }

    /**
     * One-line form of the failure, e.g. {@code main.gs:2:7: error[runtime]: division by zero},
     * or an empty string on success.
     */
    public String formatSimple(String filename) {
        return error.map(e -> e.toDiagnostic().formatSimple(filename))
                    .orElse("");
    }

    /**
     * Format the failure with default filename "input".
     */
    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }
}
