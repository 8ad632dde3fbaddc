package org.gscript.runtime;

import org.gscript.error.RuntimeError;
import org.gscript.tree.SourceSpan;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One scope of name-to-value bindings, chained to the scope it was entered from.
 * Function values keep their declaring scope reachable for as long as they are.
 */
public final class Environment {

    private final Map<String, Value> bindings;
    private final Environment enclosing;

    private Environment(Environment enclosing) {
        this.bindings = new HashMap<>();
        this.enclosing = enclosing;
    }

    /**
     * Root of a chain.
     */
    public static Environment global() {
        return new Environment(null);
    }

    /**
     * New empty scope whose parent is this one.
     */
    public Environment child() {
        return new Environment(this);
    }

    public Optional<Environment> enclosing() {
        return Optional.ofNullable(enclosing);
    }

    /**
     * Bind in this scope, overwriting any existing binding here. Shadows outer bindings.
     */
    public void define(String name, Value value) {
        bindings.put(name, value);
    }

    public Value get(String name) {
        return get(name, SourceSpan.NONE);
    }

    /**
     * Nearest binding of the name, searching outwards.
     *
     * @param span location reported if the name is unbound
     * @throws RuntimeError if no scope in the chain binds the name
     */
    public Value get(String name, SourceSpan span) {
        for (var env = this; env != null; env = env.enclosing) {
            var value = env.bindings.get(name);
            if (value != null) {
                return value;
            }
        }
        throw undefined(name, span);
    }

    public void assign(String name, Value value) {
        assign(name, value, SourceSpan.NONE);
    }

    /**
     * Replace the nearest existing binding of the name. Never creates a binding.
     *
     * @param span location reported if the name is unbound
     * @throws RuntimeError if no scope in the chain binds the name
     */
    public void assign(String name, Value value, SourceSpan span) {
        for (var env = this; env != null; env = env.enclosing) {
            if (env.bindings.containsKey(name)) {
                env.bindings.put(name, value);
                return;
            }
        }
        throw undefined(name, span);
    }

    /**
     * Whether this scope itself binds the name; enclosing scopes are not searched.
     */
    public boolean isDefinedLocally(String name) {
        return bindings.containsKey(name);
    }

    private static RuntimeError undefined(String name, SourceSpan span) {
        return new RuntimeError("undefined variable '" + name + "'", span);
    }
}
