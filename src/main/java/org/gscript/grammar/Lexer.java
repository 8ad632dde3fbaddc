package org.gscript.grammar;

import org.gscript.error.LexError;
import org.gscript.tree.SourceLocation;
import org.gscript.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns script source into tokens in a single left-to-right pass.
 * The first invalid character or unterminated string aborts the whole scan.
 */
public final class Lexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 64;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    /**
     * Scan the whole source. The returned list always ends with an {@code EOF} token.
     *
     * @throws LexError on an unexpected character or an unterminated string literal
     */
    public static List<Token> scan(String source) {
        return new Lexer(source).scanAll();
    }

    private List<Token> scanAll() {
        var tokens = new ArrayList<Token>(DEFAULT_TOKEN_CAPACITY);
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            tokens.add(nextToken());
        }
        tokens.add(Token.of(TokenType.EOF, "", SourceSpan.at(currentLocation())));
        return tokens;
    }

    private Token nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (c == '"') {
            return scanString(start);
        }
        return scanOperator(start);
    }

    private Token scanIdentifier(SourceLocation start) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        var text = input.substring(start.offset(), pos);
        var type = TokenType.keyword(text)
                            .orElse(TokenType.IDENTIFIER);
        return Token.of(type, text, span(start));
    }

    private Token scanNumber(SourceLocation start) {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        // Fraction only when a digit follows the dot
        if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
            advance();
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }
        var text = input.substring(start.offset(), pos);
        return Token.withLiteral(TokenType.NUMBER, text, Double.parseDouble(text), span(start));
    }

    private Token scanString(SourceLocation start) {
        advance();
        // skip opening quote
        while (!isAtEnd() && peek() != '"') {
            advance();
        }
        if (isAtEnd()) {
            throw new LexError("unterminated string literal", span(start));
        }
        advance();
        // skip closing quote
        var text = input.substring(start.offset(), pos);
        var value = text.substring(1, text.length() - 1);
        return Token.withLiteral(TokenType.STRING, text, value, span(start));
    }

    private Token scanOperator(SourceLocation start) {
        char c = advance();
        var type = switch (c) {
            case '(' -> TokenType.LEFT_PAREN;
            case ')' -> TokenType.RIGHT_PAREN;
            case '{' -> TokenType.LEFT_BRACE;
            case '}' -> TokenType.RIGHT_BRACE;
            case ',' -> TokenType.COMMA;
            case '.' -> TokenType.DOT;
            case '-' -> TokenType.MINUS;
            case '+' -> TokenType.PLUS;
            case ';' -> TokenType.SEMICOLON;
            case '/' -> TokenType.SLASH;
            case '*' -> TokenType.STAR;
            case ':' -> TokenType.COLON;
            case '!' -> match('=') ? TokenType.BANG_EQUAL : TokenType.BANG;
            case '=' -> match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL;
            case '<' -> match('=') ? TokenType.LESS_EQUAL : TokenType.LESS;
            case '>' -> match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER;
            default -> throw new LexError("unexpected character '" + c + "'", span(start));
        };
        return Token.of(type, input.substring(start.offset(), pos), span(start));
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '/') {
                // Line comment
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean match(char expected) {
        if (isAtEnd() || peek() != expected) {
            return false;
        }
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
