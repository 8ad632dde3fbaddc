package org.gscript.runtime;

/**
 * Rule mapping any value to a boolean in conditions and logical operators.
 * One interpreter applies exactly one rule.
 */
public enum Truthiness {
    /**
     * Only {@code nil} and {@code false} are falsy. Zero and the empty string are truthy.
     */
    NULL_AND_FALSE,

    /**
     * Additionally treats numeric zero and the empty string as falsy.
     */
    COERCING;

    public boolean test(Value value) {
        return switch (value.kind()) {
            case NIL -> false;
            case BOOLEAN -> ((Value.Bool) value).value();
            case NUMBER -> this == NULL_AND_FALSE || ((Value.Num) value).value() != 0;
            case STRING -> this == NULL_AND_FALSE || !((Value.Str) value).value().isEmpty();
            case FUNCTION, NATIVE -> true;
        };
    }
}
