package org.gscript.error;

import org.gscript.tree.SourceSpan;

/**
 * Unexpected character or unterminated string literal.
 */
public final class LexError extends ScriptError {

    public LexError(String reason, SourceSpan span) {
        super(reason, span);
    }

    @Override
    public Kind kind() {
        return Kind.LEX;
    }
}
