package org.gscript.runtime;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Interpreter configuration options.
 *
 * @param out             stream receiving {@code print} output
 * @param truthiness      rule used by conditions and logical operators
 * @param maxCallDepth    deepest allowed nesting of function calls
 * @param nativeFunctions whether built-in functions such as {@code clock} are defined
 */
public record InterpreterConfig(
    PrintStream out,
    Truthiness truthiness,
    int maxCallDepth,
    boolean nativeFunctions
) {
    public static final int DEFAULT_MAX_CALL_DEPTH = 512;

    public static final InterpreterConfig DEFAULT = new InterpreterConfig(
        System.out,
        Truthiness.NULL_AND_FALSE,
        DEFAULT_MAX_CALL_DEPTH,
        true
    );

    public InterpreterConfig {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(truthiness, "truthiness");
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("maxCallDepth must be positive, got " + maxCallDepth);
        }
    }

    public InterpreterConfig withOut(PrintStream newOut) {
        return new InterpreterConfig(newOut, truthiness, maxCallDepth, nativeFunctions);
    }
}
