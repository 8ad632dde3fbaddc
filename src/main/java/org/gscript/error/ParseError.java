package org.gscript.error;

import org.gscript.tree.SourceSpan;

/**
 * Grammar violation. Carries the lexeme of the offending token.
 */
public final class ParseError extends ScriptError {

    private final String lexeme;

    public ParseError(String reason, String lexeme, SourceSpan span) {
        super(reason + ", found " + describe(lexeme), span);
        this.lexeme = lexeme;
    }

    /**
     * Lexeme of the token the parser stopped at; empty at end of input.
     */
    public String lexeme() {
        return lexeme;
    }

    private static String describe(String lexeme) {
        return lexeme.isEmpty() ? "end of input" : "'" + lexeme + "'";
    }

    @Override
    public Kind kind() {
        return Kind.PARSE;
    }
}
