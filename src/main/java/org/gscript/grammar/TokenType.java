package org.gscript.grammar;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Token types produced by the {@link Lexer}.
 */
public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,
    COMMA, DOT, MINUS, PLUS, SEMICOLON, SLASH, STAR, COLON,

    // One or two character tokens
    BANG, BANG_EQUAL,
    EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,

    // Literals
    IDENTIFIER, STRING, NUMBER,

    // Keywords
    VAR, FUN, RETURN, PRINT, IF, ELSE, WHILE, FOR,
    TRUE, FALSE, NIL, AND, OR,

    // Reserved words without execution semantics
    CLASS, STRUCT, ENUM, INTERFACE,
    PUBLIC, PRIVATE, PROTECTED, STATIC, FINAL, ABSTRACT, ASYNC,
    EXTENDS, SUPER, THIS, BREAK, CONTINUE,

    EOF;

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("let", VAR),
        Map.entry("fn", FUN),
        Map.entry("return", RETURN),
        Map.entry("print", PRINT),
        Map.entry("if", IF),
        Map.entry("else", ELSE),
        Map.entry("while", WHILE),
        Map.entry("for", FOR),
        Map.entry("true", TRUE),
        Map.entry("false", FALSE),
        Map.entry("nil", NIL),
        Map.entry("and", AND),
        Map.entry("or", OR),
        Map.entry("class", CLASS),
        Map.entry("struct", STRUCT),
        Map.entry("enum", ENUM),
        Map.entry("interface", INTERFACE),
        Map.entry("public", PUBLIC),
        Map.entry("private", PRIVATE),
        Map.entry("protected", PROTECTED),
        Map.entry("static", STATIC),
        Map.entry("final", FINAL),
        Map.entry("abstract", ABSTRACT),
        Map.entry("async", ASYNC),
        Map.entry("extends", EXTENDS),
        Map.entry("super", SUPER),
        Map.entry("this", THIS),
        Map.entry("break", BREAK),
        Map.entry("continue", CONTINUE)
    );

    /**
     * Keyword for the given identifier text, matched case-insensitively.
     */
    public static Optional<TokenType> keyword(String text) {
        return Optional.ofNullable(KEYWORDS.get(text.toLowerCase(Locale.ROOT)));
    }
}
