package org.gscript.runtime;

import org.gscript.error.RuntimeError;
import org.gscript.tree.Expr;
import org.gscript.tree.Operator;
import org.gscript.tree.SourceSpan;
import org.gscript.tree.Stmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tree-walking interpreter. Executes statements against a chain of {@link Environment}s.
 *
 * <p>The environment in effect is passed down every call rather than kept in a field,
 * so leaving a block or call by any route leaves the caller's environment untouched.
 * A {@code return} travels back up as a {@link Completion.Returned} value.
 *
 * <p>One interpreter keeps its global environment across {@link #interpret(List)} calls.
 * Printed lines are kept only for the most recent call.
 */
public final class Interpreter implements Expr.Visitor<Value, Environment>, Stmt.Visitor<Completion, Environment> {

    private final InterpreterConfig config;
    private final Environment globals;
    private final List<String> output;
    private int callDepth;

    private Interpreter(InterpreterConfig config) {
        this.config = config;
        this.globals = Environment.global();
        this.output = new ArrayList<>();
        this.callDepth = 0;
        if (config.nativeFunctions()) {
            NativeFunctions.install(globals);
        }
    }

    public static Interpreter create() {
        return create(InterpreterConfig.DEFAULT);
    }

    public static Interpreter create(InterpreterConfig config) {
        return new Interpreter(config);
    }

    public Environment globals() {
        return globals;
    }

    /**
     * Lines printed by the most recent {@link #interpret(List)} call, in order.
     */
    public List<String> output() {
        return List.copyOf(output);
    }

    /**
     * Execute top-level statements in order against the global environment.
     * The first runtime error stops execution; output printed before it stays printed.
     * Lines captured by the previous call are discarded.
     *
     * @return the runtime error that stopped execution, if any
     */
    public Optional<RuntimeError> interpret(List<Stmt> statements) {
        output.clear();
        for (var statement : statements) {
            try {
                var completion = execute(statement, globals);
                if (completion.isReturned()) {
                    return Optional.of(new RuntimeError("cannot return from top-level code", statement.span()));
                }
            } catch (RuntimeError e) {
                return Optional.of(e);
            } catch (StackOverflowError e) {
                // Host stack ran out before maxCallDepth was reached
                return Optional.of(new RuntimeError("stack overflow", statement.span()));
            }
        }
        return Optional.empty();
    }

    /**
     * Execute one statement in the given environment.
     */
    public Completion execute(Stmt stmt, Environment env) {
        return stmt.accept(this, env);
    }

    /**
     * Evaluate one expression in the given environment.
     */
    public Value evaluate(Expr expr, Environment env) {
        return expr.accept(this, env);
    }

    /**
     * Invoke a function or native with already evaluated arguments.
     *
     * @param span location reported on failure
     */
    public Value call(Value callee, List<Value> arguments, SourceSpan span) {
        if (callee instanceof Value.Function function) {
            checkArity(function.arity(), arguments.size(), span);
            return callFunction(function, arguments, span);
        }
        if (callee instanceof Value.Native nativeFunction) {
            checkArity(nativeFunction.arity(), arguments.size(), span);
            return nativeFunction.body().call(arguments);
        }
        throw new RuntimeError("can only call functions", span);
    }

    // === Statements ===

    @Override
    public Completion visitVar(Stmt.Var stmt, Environment env) {
        var value = stmt.initializer()
                        .map(initializer -> evaluate(initializer, env))
                        .orElse(Value.NIL);
        env.define(stmt.name(), value);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitFunction(Stmt.Function stmt, Environment env) {
        env.define(stmt.name(), new Value.Function(stmt, env));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitExpression(Stmt.Expression stmt, Environment env) {
        evaluate(stmt.expression(), env);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitPrint(Stmt.Print stmt, Environment env) {
        var text = evaluate(stmt.expression(), env).text();
        output.add(text);
        config.out().println(text);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitReturn(Stmt.Return stmt, Environment env) {
        var value = stmt.value()
                        .map(expr -> evaluate(expr, env))
                        .orElse(Value.NIL);
        return Completion.returned(value);
    }

    @Override
    public Completion visitIf(Stmt.If stmt, Environment env) {
        if (isTruthy(evaluate(stmt.condition(), env))) {
            return execute(stmt.thenBranch(), env);
        }
        return stmt.elseBranch()
                   .map(elseBranch -> execute(elseBranch, env))
                   .orElse(Completion.NORMAL);
    }

    @Override
    public Completion visitWhile(Stmt.While stmt, Environment env) {
        while (isTruthy(evaluate(stmt.condition(), env))) {
            var completion = execute(stmt.body(), env);
            if (completion.isReturned()) {
                return completion;
            }
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitBlock(Stmt.Block stmt, Environment env) {
        return executeAll(stmt.statements(), env.child());
    }

    /**
     * Run statements in order, stopping at the first {@code return}.
     */
    private Completion executeAll(List<Stmt> statements, Environment env) {
        for (var statement : statements) {
            var completion = execute(statement, env);
            if (completion.isReturned()) {
                return completion;
            }
        }
        return Completion.NORMAL;
    }

    // === Expressions ===

    @Override
    public Value visitLiteral(Expr.Literal expr, Environment env) {
        var value = expr.value();
        if (value == null) {
            return Value.NIL;
        }
        if (value instanceof Double number) {
            return Value.number(number);
        }
        if (value instanceof String string) {
            return Value.string(string);
        }
        if (value instanceof Boolean bool) {
            return Value.bool(bool);
        }
        throw new IllegalStateException("Unsupported literal type: " + value.getClass().getName());
    }

    @Override
    public Value visitVariable(Expr.Variable expr, Environment env) {
        return env.get(expr.name(), expr.span());
    }

    @Override
    public Value visitAssign(Expr.Assign expr, Environment env) {
        var value = evaluate(expr.value(), env);
        env.assign(expr.name(), value, expr.span());
        return value;
    }

    @Override
    public Value visitGrouping(Expr.Grouping expr, Environment env) {
        return evaluate(expr.expression(), env);
    }

    @Override
    public Value visitUnary(Expr.Unary expr, Environment env) {
        var right = evaluate(expr.right(), env);
        return switch (expr.operator()) {
            case MINUS -> {
                if (right instanceof Value.Num num) {
                    yield Value.number(-num.value());
                }
                throw new RuntimeError("operand must be a number", expr.span());
            }
            case BANG -> Value.bool(!isTruthy(right));
            default -> throw new IllegalStateException("Not a unary operator: " + expr.operator());
        };
    }

    @Override
    public Value visitBinary(Expr.Binary expr, Environment env) {
        var left = evaluate(expr.left(), env);
        var right = evaluate(expr.right(), env);
        var operator = expr.operator();
        var span = expr.span();

        return switch (operator) {
            case PLUS -> add(left, right, span);
            case MINUS -> Value.number(number(left, span, operator) - number(right, span, operator));
            case STAR -> Value.number(number(left, span, operator) * number(right, span, operator));
            case SLASH -> divide(left, right, span);
            case GREATER -> Value.bool(number(left, span, operator) > number(right, span, operator));
            case GREATER_EQUAL -> Value.bool(number(left, span, operator) >= number(right, span, operator));
            case LESS -> Value.bool(number(left, span, operator) < number(right, span, operator));
            case LESS_EQUAL -> Value.bool(number(left, span, operator) <= number(right, span, operator));
            case EQUAL_EQUAL -> Value.bool(left.isEqualTo(right));
            case BANG_EQUAL -> Value.bool(!left.isEqualTo(right));
            case BANG, AND, OR -> throw new IllegalStateException("Not a binary operator: " + operator);
        };
    }

    @Override
    public Value visitLogical(Expr.Logical expr, Environment env) {
        var left = evaluate(expr.left(), env);
        return switch (expr.operator()) {
            case OR -> isTruthy(left) ? left : evaluate(expr.right(), env);
            case AND -> isTruthy(left) ? evaluate(expr.right(), env) : left;
            default -> throw new IllegalStateException("Not a logical operator: " + expr.operator());
        };
    }

    @Override
    public Value visitCall(Expr.Call expr, Environment env) {
        var callee = evaluate(expr.callee(), env);
        if (callee.kind() != Value.Kind.FUNCTION && callee.kind() != Value.Kind.NATIVE) {
            throw new RuntimeError("can only call functions", expr.span());
        }

        var arguments = new ArrayList<Value>(expr.arguments().size());
        for (var argument : expr.arguments()) {
            arguments.add(evaluate(argument, env));
        }

        return call(callee, arguments, expr.span());
    }

    // === Helpers ===

    private Value callFunction(Value.Function function, List<Value> arguments, SourceSpan span) {
        if (callDepth >= config.maxCallDepth()) {
            throw new RuntimeError("stack overflow", span);
        }

        var frame = function.closure().child();
        var params = function.declaration().params();
        for (int i = 0; i < params.size(); i++) {
            frame.define(params.get(i), arguments.get(i));
        }

        callDepth++;
        try {
            var completion = executeAll(function.declaration().body(), frame);
            if (completion instanceof Completion.Returned returned) {
                return returned.value();
            }
            return Value.NIL;
        } finally {
            callDepth--;
        }
    }

    private static void checkArity(int expected, int actual, SourceSpan span) {
        if (expected != actual) {
            throw new RuntimeError("expected " + expected + " arguments but got " + actual, span);
        }
    }

    private static Value add(Value left, Value right, SourceSpan span) {
        if (left instanceof Value.Num a && right instanceof Value.Num b) {
            return Value.number(a.value() + b.value());
        }
        if (left instanceof Value.Str || right instanceof Value.Str) {
            return Value.string(left.text() + right.text());
        }
        throw new RuntimeError("operands must be two numbers or one must be a string", span);
    }

    private static Value divide(Value left, Value right, SourceSpan span) {
        var dividend = number(left, span, Operator.SLASH);
        var divisor = number(right, span, Operator.SLASH);
        if (divisor == 0) {
            throw new RuntimeError("division by zero", span);
        }
        return Value.number(dividend / divisor);
    }

    private static double number(Value operand, SourceSpan span, Operator operator) {
        if (operand instanceof Value.Num num) {
            return num.value();
        }
        throw new RuntimeError("operands must be numbers for operator '" + operator.symbol() + "'", span);
    }

    private boolean isTruthy(Value value) {
        return config.truthiness().test(value);
    }
}
