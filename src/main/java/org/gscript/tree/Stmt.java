package org.gscript.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statement nodes produced by the parser. Every node is immutable once built.
 */
public sealed interface Stmt {

    SourceSpan span();

    <R, C> R accept(Visitor<R, C> visitor, C context);

    /**
     * Variable declaration: let name = initializer;
     */
    record Var(SourceSpan span, String name, Optional<Expr> initializer) implements Stmt {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitVar(this, context);
        }
    }

    /**
     * Function declaration: fn name(params) { body }
     */
    record Function(SourceSpan span, String name, List<String> params, List<Stmt> body) implements Stmt {
        public Function {
            params = List.copyOf(params);
            body = List.copyOf(body);
        }

        public int arity() {
            return params.size();
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitFunction(this, context);
        }
    }

    /**
     * Expression evaluated for its side effects.
     */
    record Expression(SourceSpan span, Expr expression) implements Stmt {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitExpression(this, context);
        }
    }

    record Print(SourceSpan span, Expr expression) implements Stmt {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitPrint(this, context);
        }
    }

    record Return(SourceSpan span, Optional<Expr> value) implements Stmt {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitReturn(this, context);
        }
    }

    record If(SourceSpan span, Expr condition, Stmt thenBranch, Optional<Stmt> elseBranch) implements Stmt {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitIf(this, context);
        }
    }

    record While(SourceSpan span, Expr condition, Stmt body) implements Stmt {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitWhile(this, context);
        }
    }

    /**
     * Braced statement list with its own scope.
     */
    record Block(SourceSpan span, List<Stmt> statements) implements Stmt {
        public Block {
            statements = List.copyOf(statements);
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitBlock(this, context);
        }
    }

    /**
     * Build the tree a {@code for} loop stands for.
     *
     * <pre>
     * for (init; cond; incr) body   ==>   { init; while (cond) { body; incr; } }
     * </pre>
     *
     * A missing condition becomes the literal {@code true}; a missing initializer or increment is left out.
     */
    static Block forLoop(SourceSpan span,
                         Optional<Stmt> initializer,
                         Optional<Expr> condition,
                         Optional<Expr> increment,
                         Stmt body) {
        var loopBody = increment.<Stmt>map(incr -> new Block(body.span(),
                                                              List.of(body, new Expression(incr.span(), incr))))
                                .orElse(body);
        var loopCondition = condition.orElseGet(() -> Expr.Literal.bool(span, true));
        var statements = new ArrayList<Stmt>(2);
        initializer.ifPresent(statements::add);
        statements.add(new While(span, loopCondition, loopBody));
        return new Block(span, statements);
    }

    interface Visitor<R, C> {
        R visitVar(Var stmt, C context);

        R visitFunction(Function stmt, C context);

        R visitExpression(Expression stmt, C context);

        R visitPrint(Print stmt, C context);

        R visitReturn(Return stmt, C context);

        R visitIf(If stmt, C context);

        R visitWhile(While stmt, C context);

        R visitBlock(Block stmt, C context);
    }
}
