package org.gscript.tree;

/**
 * Operators that appear in unary, binary and logical expressions.
 */
public enum Operator {
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    BANG("!"),
    EQUAL_EQUAL("=="),
    BANG_EQUAL("!="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    LESS("<"),
    LESS_EQUAL("<="),
    AND("and"),
    OR("or");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
