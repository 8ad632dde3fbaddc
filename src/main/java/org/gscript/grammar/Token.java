package org.gscript.grammar;

import org.gscript.tree.SourceSpan;

import java.util.Optional;

/**
 * A lexical unit. The literal is a {@link Double} for {@code NUMBER} tokens,
 * a {@link String} for {@code STRING} tokens and absent otherwise.
 */
public record Token(TokenType type, String lexeme, Optional<Object> literal, SourceSpan span) {

    public static Token of(TokenType type, String lexeme, SourceSpan span) {
        return new Token(type, lexeme, Optional.empty(), span);
    }

    public static Token withLiteral(TokenType type, String lexeme, Object literal, SourceSpan span) {
        return new Token(type, lexeme, Optional.of(literal), span);
    }

    public int line() {
        return span.line();
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' at " + span.start();
    }
}
