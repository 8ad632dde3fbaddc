package org.gscript.runtime;

import org.gscript.tree.Stmt;

import java.math.BigDecimal;
import java.util.List;

/**
 * Runtime value. Every variant renders itself and defines its own equality,
 * so a new variant cannot be added without deciding both.
 */
public sealed interface Value {

    /**
     * Variant tag, for exhaustive {@code switch} at consumption sites.
     */
    enum Kind {
        NUMBER,
        BOOLEAN,
        STRING,
        NIL,
        FUNCTION,
        NATIVE
    }

    Nil NIL = new Nil();
    Bool TRUE = new Bool(true);
    Bool FALSE = new Bool(false);

    Kind kind();

    /**
     * Textual form used by {@code print} and string concatenation.
     */
    String text();

    /**
     * Value equality: values of different kinds are never equal.
     */
    boolean isEqualTo(Value other);

    static Num number(double value) {
        return new Num(value);
    }

    static Bool bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Str string(String value) {
        return new Str(value);
    }

    record Num(double value) implements Value {
        private static final double PLAIN_INTEGRAL_LIMIT = 1e21;

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public String text() {
            // Integral values below 1e21 print as plain digits: 15, not 15.0 or 1.5E1
            if (value == Math.rint(value) && Math.abs(value) < PLAIN_INTEGRAL_LIMIT) {
                return new BigDecimal(value).toPlainString();
            }
            return Double.toString(value);
        }

        @Override
        public boolean isEqualTo(Value other) {
            return other instanceof Num num && num.value == value;
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public String text() {
            return String.valueOf(value);
        }

        @Override
        public boolean isEqualTo(Value other) {
            return other instanceof Bool bool && bool.value == value;
        }
    }

    record Str(String value) implements Value {
        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public String text() {
            return value;
        }

        @Override
        public boolean isEqualTo(Value other) {
            return other instanceof Str str && str.value.equals(value);
        }
    }

    final class Nil implements Value {
        private Nil() {}

        @Override
        public Kind kind() {
            return Kind.NIL;
        }

        @Override
        public String text() {
            return "null";
        }

        @Override
        public boolean isEqualTo(Value other) {
            return other instanceof Nil;
        }

        @Override
        public String toString() {
            return "Nil";
        }
    }

    /**
     * User-defined function together with the environment it was declared in.
     */
    record Function(Stmt.Function declaration, Environment closure) implements Value {
        public String name() {
            return declaration.name();
        }

        public int arity() {
            return declaration.arity();
        }

        @Override
        public Kind kind() {
            return Kind.FUNCTION;
        }

        @Override
        public String text() {
            return "<fn " + name() + ">";
        }

        @Override
        public boolean isEqualTo(Value other) {
            return this == other;
        }

        @Override
        public String toString() {
            return text();
        }
    }

    /**
     * Function implemented by the host.
     */
    record Native(String name, int arity, Body body) implements Value {
        @FunctionalInterface
        public interface Body {
            Value call(List<Value> arguments);
        }

        @Override
        public Kind kind() {
            return Kind.NATIVE;
        }

        @Override
        public String text() {
            return "<native fn " + name + ">";
        }

        @Override
        public boolean isEqualTo(Value other) {
            return this == other;
        }

        @Override
        public String toString() {
            return text();
        }
    }
}
