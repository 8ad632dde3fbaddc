package org.gscript.error;

import org.gscript.tree.SourceSpan;

/**
 * Evaluation failure: undefined variable, wrong operand types, division by zero,
 * calling a non-function, argument-count mismatch or call stack exhaustion.
 */
public final class RuntimeError extends ScriptError {

    public RuntimeError(String reason, SourceSpan span) {
        super(reason, span);
    }

    @Override
    public Kind kind() {
        return Kind.RUNTIME;
    }
}
