package org.gscript;

import org.gscript.error.LexError;
import org.gscript.error.ParseError;
import org.gscript.grammar.Lexer;
import org.gscript.grammar.Parser;
import org.gscript.grammar.Token;
import org.gscript.runtime.Interpreter;
import org.gscript.runtime.InterpreterConfig;
import org.gscript.runtime.RunResult;
import org.gscript.runtime.Truthiness;
import org.gscript.tree.Stmt;

import java.io.PrintStream;
import java.util.List;

/**
 * Entry point for running GScript source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = GScript.run("""
 *     let x = 5;
 *     fn twice(n) { return n * 2; }
 *     print(twice(x));
 *     """);
 *
 * result.output();            // ["10"]
 * result.formatDiagnostics(); // "" on success
 * }</pre>
 *
 * <p>An instance keeps its global environment between {@link #eval(String)} calls,
 * so declarations from one call are visible in the next.
 */
public final class GScript {
    private final Interpreter interpreter;

    private GScript(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    /**
     * Create a session with default configuration.
     */
    public static GScript create() {
        return create(InterpreterConfig.DEFAULT);
    }

    /**
     * Create a session with custom configuration.
     */
    public static GScript create(InterpreterConfig config) {
        return new GScript(Interpreter.create(config));
    }

    /**
     * Run source in a fresh session with default configuration.
     */
    public static RunResult run(String source) {
        return create().eval(source);
    }

    /**
     * Run source in a fresh session with custom configuration.
     */
    public static RunResult run(String source, InterpreterConfig config) {
        return create(config).eval(source);
    }

    /**
     * Tokenize source.
     *
     * @throws LexError on the first invalid character or unterminated string
     */
    public static List<Token> scan(String source) {
        return Lexer.scan(source);
    }

    /**
     * Tokenize and parse source.
     *
     * @throws LexError   on the first invalid character or unterminated string
     * @throws ParseError on the first grammar violation
     */
    public static List<Stmt> parse(String source) {
        return Parser.parse(Lexer.scan(source));
    }

    /**
     * Scan, parse and execute source in this session. Never throws for script errors.
     */
    public RunResult eval(String source) {
        List<Stmt> statements;
        try {
            statements = parse(source);
        } catch (LexError | ParseError e) {
            return RunResult.failure(List.of(), e, source);
        }

        var error = interpreter.interpret(statements);
        var printed = interpreter.output();

        return error.map(e -> RunResult.failure(printed, e, source))
                    .orElseGet(() -> RunResult.success(printed, source));
    }

    public Interpreter interpreter() {
        return interpreter;
    }

    /**
     * Create a builder for more complex session configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PrintStream out = InterpreterConfig.DEFAULT.out();
        private Truthiness truthiness = InterpreterConfig.DEFAULT.truthiness();
        private int maxCallDepth = InterpreterConfig.DEFAULT.maxCallDepth();
        private boolean nativeFunctions = InterpreterConfig.DEFAULT.nativeFunctions();

        private Builder() {}

        public Builder out(PrintStream out) {
            this.out = out;
            return this;
        }

        public Builder truthiness(Truthiness truthiness) {
            this.truthiness = truthiness;
            return this;
        }

        public Builder maxCallDepth(int maxCallDepth) {
            this.maxCallDepth = maxCallDepth;
            return this;
        }

        public Builder nativeFunctions(boolean enabled) {
            this.nativeFunctions = enabled;
            return this;
        }

        public InterpreterConfig config() {
            return new InterpreterConfig(out, truthiness, maxCallDepth, nativeFunctions);
        }

        public GScript build() {
            return create(config());
        }
    }
}
