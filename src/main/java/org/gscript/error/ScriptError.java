package org.gscript.error;

import org.gscript.tree.SourceSpan;

/**
 * Failure raised by one of the pipeline stages. All three kinds are fatal to the current run.
 */
public abstract sealed class ScriptError extends RuntimeException permits LexError, ParseError, RuntimeError {

    /**
     * Pipeline stage that raised the error.
     */
    public enum Kind {
        LEX("lex", "lex error"),
        PARSE("parse", "parse error"),
        RUNTIME("runtime", "runtime error");

        private final String code;
        private final String display;

        Kind(String code, String display) {
            this.code = code;
            this.display = display;
        }

        public String code() {
            return code;
        }

        public String display() {
            return display;
        }
    }

    private final String reason;
    private final SourceSpan span;

    protected ScriptError(String reason, SourceSpan span) {
        super(reason + " at " + span.start());
        this.reason = reason;
        this.span = span;
    }

    public abstract Kind kind();

    /**
     * Error text without location.
     */
    public String reason() {
        return reason;
    }

    public SourceSpan span() {
        return span;
    }

    public int line() {
        return span.line();
    }

    /**
     * Error text with location, e.g. {@code "undefined variable 'x' at 3:7"}.
     */
    public String message() {
        return getMessage();
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.error(kind().code(), reason, span)
                         .withLabel(kind().display());
    }
}
