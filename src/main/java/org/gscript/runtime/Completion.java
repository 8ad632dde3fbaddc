package org.gscript.runtime;

/**
 * Outcome of executing a statement: either control falls through to the next
 * statement, or a {@code return} is unwinding towards the enclosing call.
 */
public sealed interface Completion {

    Completion NORMAL = new Normal();

    boolean isReturned();

    static Completion returned(Value value) {
        return new Returned(value);
    }

    final class Normal implements Completion {
        private Normal() {}

        @Override
        public boolean isReturned() {
            return false;
        }

        @Override
        public String toString() {
            return "Normal";
        }
    }

    /**
     * A {@code return} carrying the call's result.
     */
    record Returned(Value value) implements Completion {
        @Override
        public boolean isReturned() {
            return true;
        }
    }
}
