package org.gscript.tree;

import java.util.List;

/**
 * Expression nodes produced by the parser. Every node is immutable once built.
 */
public sealed interface Expr {

    /**
     * Source location of this expression in the script.
     */
    SourceSpan span();

    <R, C> R accept(Visitor<R, C> visitor, C context);

    /**
     * Constant value: a {@link Double}, a {@link String}, a {@link Boolean} or {@code null} for {@code nil}.
     */
    record Literal(SourceSpan span, Object value) implements Expr {
        public static Literal number(SourceSpan span, double value) {
            return new Literal(span, value);
        }

        public static Literal string(SourceSpan span, String value) {
            return new Literal(span, value);
        }

        public static Literal bool(SourceSpan span, boolean value) {
            return new Literal(span, value);
        }

        public static Literal nil(SourceSpan span) {
            return new Literal(span, null);
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitLiteral(this, context);
        }
    }

    /**
     * Read of a named binding.
     */
    record Variable(SourceSpan span, String name) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitVariable(this, context);
        }
    }

    /**
     * Assignment to an existing binding: name = value
     */
    record Assign(SourceSpan span, String name, Expr value) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitAssign(this, context);
        }
    }

    /**
     * Arithmetic, comparison and equality: left op right
     */
    record Binary(SourceSpan span, Expr left, Operator operator, Expr right) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitBinary(this, context);
        }
    }

    /**
     * Prefix negation: -right, !right
     */
    record Unary(SourceSpan span, Operator operator, Expr right) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitUnary(this, context);
        }
    }

    /**
     * Short-circuiting and/or.
     */
    record Logical(SourceSpan span, Expr left, Operator operator, Expr right) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitLogical(this, context);
        }
    }

    /**
     * Call: callee(arguments)
     */
    record Call(SourceSpan span, Expr callee, List<Expr> arguments) implements Expr {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitCall(this, context);
        }
    }

    /**
     * Parenthesized expression: (expression)
     */
    record Grouping(SourceSpan span, Expr expression) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitGrouping(this, context);
        }
    }

    /**
     * One method per node type, so a new node type breaks every consumer at compile time.
     */
    interface Visitor<R, C> {
        R visitLiteral(Literal expr, C context);

        R visitVariable(Variable expr, C context);

        R visitAssign(Assign expr, C context);

        R visitBinary(Binary expr, C context);

        R visitUnary(Unary expr, C context);

        R visitLogical(Logical expr, C context);

        R visitCall(Call expr, C context);

        R visitGrouping(Grouping expr, C context);
    }
}
