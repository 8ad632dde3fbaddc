package org.gscript.runtime;

import java.util.List;

/**
 * Built-in functions defined in every global environment unless disabled.
 */
public final class NativeFunctions {
    private NativeFunctions() {}

    /**
     * {@code clock()}: seconds since the epoch, with millisecond precision.
     */
    public static final Value.Native CLOCK = new Value.Native("clock", 0, NativeFunctions::clock);

    public static List<Value.Native> all() {
        return List.of(CLOCK);
    }

    static void install(Environment globals) {
        for (var function : all()) {
            globals.define(function.name(), function);
        }
    }

    private static Value clock(List<Value> arguments) {
        return Value.number(System.currentTimeMillis() / 1000.0);
    }
}
