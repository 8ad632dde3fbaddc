package org.gscript.grammar;

import org.gscript.error.ParseError;
import org.gscript.tree.Expr;
import org.gscript.tree.Operator;
import org.gscript.tree.SourceSpan;
import org.gscript.tree.Stmt;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for GScript.
 * Converts the token sequence into top-level statements.
 *
 * <pre>
 * program     := declaration* EOF
 * declaration := varDecl | functionDecl | statement
 * statement   := ifStmt | whileStmt | forStmt | printStmt | returnStmt | block | exprStmt
 * expression  := assignment
 * assignment  := logic_or ( "=" assignment )?
 * logic_or    := logic_and ( "or" logic_and )*
 * logic_and   := equality ( "and" equality )*
 * equality    := comparison ( ( "==" | "!=" ) comparison )*
 * comparison  := term ( ( ">" | ">=" | "<" | "<=" ) term )*
 * term        := factor ( ( "+" | "-" ) factor )*
 * factor      := unary ( ( "*" | "/" ) unary )*
 * unary       := ( "!" | "-" ) unary | call
 * call        := primary ( "(" arguments? ")" )*
 * primary     := NUMBER | STRING | "true" | "false" | "nil" | IDENTIFIER | "(" expression ")"
 * </pre>
 *
 * The first grammar violation aborts the whole parse. Statements and expressions may nest
 * at most {@link #MAX_NESTING_DEPTH} levels deep.
 */
public final class Parser {
    public static final int MAX_PARAMETERS = 255;
    public static final int MAX_ARGUMENTS = 255;
    public static final int MAX_NESTING_DEPTH = 256;

    // Reserved words that start a declaration the language does not execute
    private static final Set<TokenType> UNSUPPORTED_DECLARATIONS = EnumSet.of(
        TokenType.CLASS, TokenType.STRUCT, TokenType.ENUM, TokenType.INTERFACE,
        TokenType.PUBLIC, TokenType.PRIVATE, TokenType.PROTECTED, TokenType.STATIC,
        TokenType.FINAL, TokenType.ABSTRACT, TokenType.ASYNC, TokenType.EXTENDS
    );

    private static final Set<TokenType> UNSUPPORTED_STATEMENTS = EnumSet.of(TokenType.BREAK, TokenType.CONTINUE);

    private static final Set<TokenType> UNSUPPORTED_PRIMARIES = EnumSet.of(TokenType.THIS, TokenType.SUPER);

    private final List<Token> tokens;
    private int pos;
    private int depth;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
        this.depth = 0;
    }

    /**
     * Parse a token sequence terminated by {@code EOF}.
     *
     * @throws ParseError on the first grammar violation
     */
    public static List<Stmt> parse(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token sequence must end with EOF");
        }
        return new Parser(tokens).parseProgram();
    }

    /**
     * Scan and parse script source in one step.
     */
    public static List<Stmt> parse(String source) {
        return parse(Lexer.scan(source));
    }

    private List<Stmt> parseProgram() {
        var statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(parseDeclaration());
        }
        return List.copyOf(statements);
    }

    // === Declarations ===

    private Stmt parseDeclaration() {
        if (UNSUPPORTED_DECLARATIONS.contains(peek().type())) {
            throw unsupported(peek());
        }
        if (check(TokenType.FUN)) {
            return parseFunction();
        }
        if (check(TokenType.VAR)) {
            return parseVar();
        }
        return parseStatement();
    }

    private Stmt parseFunction() {
        var start = advance();
        // fn
        var name = expect(TokenType.IDENTIFIER, "expected function name");
        expect(TokenType.LEFT_PAREN, "expected '(' after function name");

        var params = new ArrayList<String>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_PARAMETERS) {
                    throw error(peek(), "cannot have more than " + MAX_PARAMETERS + " parameters");
                }
                params.add(expect(TokenType.IDENTIFIER, "expected parameter name").lexeme());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RIGHT_PAREN, "expected ')' after parameters");
        expect(TokenType.LEFT_BRACE, "expected '{' before function body");
        var body = parseBlockBody();

        return new Stmt.Function(spanFrom(start), name.lexeme(), params, body);
    }

    private Stmt parseVar() {
        var start = advance();
        // let
        var name = expect(TokenType.IDENTIFIER, "expected variable name");

        Optional<Expr> initializer = Optional.empty();
        if (match(TokenType.EQUAL)) {
            initializer = Optional.of(parseExpression());
        }
        expect(TokenType.SEMICOLON, "expected ';' after variable declaration");

        return new Stmt.Var(spanFrom(start), name.lexeme(), initializer);
    }

    // === Statements ===

    private Stmt parseStatement() {
        return nested("statement", this::parseStatementBody);
    }

    private Stmt parseStatementBody() {
        var token = peek();
        if (UNSUPPORTED_STATEMENTS.contains(token.type()) || UNSUPPORTED_DECLARATIONS.contains(token.type())) {
            throw unsupported(token);
        }
        return switch (token.type()) {
            case IF -> parseIf();
            case WHILE -> parseWhile();
            case FOR -> parseFor();
            case PRINT -> parsePrint();
            case RETURN -> parseReturn();
            case LEFT_BRACE -> parseBlock();
            default -> parseExpressionStatement();
        };
    }

    private Stmt parseIf() {
        var start = advance();
        expect(TokenType.LEFT_PAREN, "expected '(' after 'if'");
        var condition = parseExpression();
        expect(TokenType.RIGHT_PAREN, "expected ')' after if condition");

        var thenBranch = parseStatement();
        Optional<Stmt> elseBranch = Optional.empty();
        if (match(TokenType.ELSE)) {
            elseBranch = Optional.of(parseStatement());
        }

        return new Stmt.If(spanFrom(start), condition, thenBranch, elseBranch);
    }

    private Stmt parseWhile() {
        var start = advance();
        expect(TokenType.LEFT_PAREN, "expected '(' after 'while'");
        var condition = parseExpression();
        expect(TokenType.RIGHT_PAREN, "expected ')' after condition");
        var body = parseStatement();

        return new Stmt.While(spanFrom(start), condition, body);
    }

    private Stmt parseFor() {
        var start = advance();
        expect(TokenType.LEFT_PAREN, "expected '(' after 'for'");

        Optional<Stmt> initializer;
        if (match(TokenType.SEMICOLON)) {
            initializer = Optional.empty();
        } else if (check(TokenType.VAR)) {
            initializer = Optional.of(parseVar());
        } else {
            initializer = Optional.of(parseExpressionStatement());
        }

        Optional<Expr> condition = Optional.empty();
        if (!check(TokenType.SEMICOLON)) {
            condition = Optional.of(parseExpression());
        }
        expect(TokenType.SEMICOLON, "expected ';' after loop condition");

        Optional<Expr> increment = Optional.empty();
        if (!check(TokenType.RIGHT_PAREN)) {
            increment = Optional.of(parseExpression());
        }
        expect(TokenType.RIGHT_PAREN, "expected ')' after for clauses");

        var body = parseStatement();

        return Stmt.forLoop(spanFrom(start), initializer, condition, increment, body);
    }

    private Stmt parsePrint() {
        var start = advance();
        var value = parseExpression();
        expect(TokenType.SEMICOLON, "expected ';' after value");

        return new Stmt.Print(spanFrom(start), value);
    }

    private Stmt parseReturn() {
        var start = advance();
        Optional<Expr> value = Optional.empty();
        if (!check(TokenType.SEMICOLON)) {
            value = Optional.of(parseExpression());
        }
        expect(TokenType.SEMICOLON, "expected ';' after return value");

        return new Stmt.Return(spanFrom(start), value);
    }

    private Stmt parseBlock() {
        var start = advance();
        var statements = parseBlockBody();

        return new Stmt.Block(spanFrom(start), statements);
    }

    /**
     * Statements up to and including the closing brace; the opening brace is already consumed.
     */
    private List<Stmt> parseBlockBody() {
        var statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(nested("statement", this::parseDeclaration));
        }
        expect(TokenType.RIGHT_BRACE, "expected '}' after block");
        return statements;
    }

    private Stmt parseExpressionStatement() {
        var start = peek();
        var expression = parseExpression();
        expect(TokenType.SEMICOLON, "expected ';' after expression");

        return new Stmt.Expression(spanFrom(start), expression);
    }

    // === Expressions ===

    private Expr parseExpression() {
        return nested("expression", this::parseAssignment);
    }

    private Expr parseAssignment() {
        var start = peek();
        var expr = parseOr();

        if (check(TokenType.EQUAL)) {
            var equals = advance();
            var value = nested("expression", this::parseAssignment);

            if (expr instanceof Expr.Variable variable) {
                return new Expr.Assign(spanFrom(start), variable.name(), value);
            }
            throw error(equals, "invalid assignment target");
        }

        return expr;
    }

    private Expr parseOr() {
        var start = peek();
        var expr = parseAnd();

        while (match(TokenType.OR)) {
            var right = parseAnd();
            expr = new Expr.Logical(spanFrom(start), expr, Operator.OR, right);
        }

        return expr;
    }

    private Expr parseAnd() {
        var start = peek();
        var expr = parseEquality();

        while (match(TokenType.AND)) {
            var right = parseEquality();
            expr = new Expr.Logical(spanFrom(start), expr, Operator.AND, right);
        }

        return expr;
    }

    private Expr parseEquality() {
        var start = peek();
        var expr = parseComparison();

        while (check(TokenType.EQUAL_EQUAL) || check(TokenType.BANG_EQUAL)) {
            var operator = toOperator(advance());
            var right = parseComparison();
            expr = new Expr.Binary(spanFrom(start), expr, operator, right);
        }

        return expr;
    }

    private Expr parseComparison() {
        var start = peek();
        var expr = parseTerm();

        while (check(TokenType.GREATER) || check(TokenType.GREATER_EQUAL)
               || check(TokenType.LESS) || check(TokenType.LESS_EQUAL)) {
            var operator = toOperator(advance());
            var right = parseTerm();
            expr = new Expr.Binary(spanFrom(start), expr, operator, right);
        }

        return expr;
    }

    private Expr parseTerm() {
        var start = peek();
        var expr = parseFactor();

        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            var operator = toOperator(advance());
            var right = parseFactor();
            expr = new Expr.Binary(spanFrom(start), expr, operator, right);
        }

        return expr;
    }

    private Expr parseFactor() {
        var start = peek();
        var expr = parseUnary();

        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            var operator = toOperator(advance());
            var right = parseUnary();
            expr = new Expr.Binary(spanFrom(start), expr, operator, right);
        }

        return expr;
    }

    private Expr parseUnary() {
        if (check(TokenType.BANG) || check(TokenType.MINUS)) {
            var start = advance();
            var right = nested("expression", this::parseUnary);
            return new Expr.Unary(spanFrom(start), toOperator(start), right);
        }
        return parseCall();
    }

    private Expr parseCall() {
        var start = peek();
        var expr = parsePrimary();

        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                var arguments = parseArguments();
                expr = new Expr.Call(spanFrom(start), expr, arguments);
            } else if (check(TokenType.DOT)) {
                throw unsupported(peek());
            } else {
                break;
            }
        }

        return expr;
    }

    /**
     * Arguments up to and including the closing parenthesis; the opening one is already consumed.
     */
    private List<Expr> parseArguments() {
        var arguments = new ArrayList<Expr>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (arguments.size() >= MAX_ARGUMENTS) {
                    throw error(peek(), "cannot have more than " + MAX_ARGUMENTS + " arguments");
                }
                arguments.add(parseExpression());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RIGHT_PAREN, "expected ')' after arguments");
        return arguments;
    }

    private Expr parsePrimary() {
        var token = peek();

        if (UNSUPPORTED_PRIMARIES.contains(token.type())) {
            throw unsupported(token);
        }

        return switch (token.type()) {
            case NUMBER -> {
                advance();
                yield Expr.Literal.number(token.span(), (Double) token.literal().orElseThrow());
            }
            case STRING -> {
                advance();
                yield Expr.Literal.string(token.span(), (String) token.literal().orElseThrow());
            }
            case TRUE -> {
                advance();
                yield Expr.Literal.bool(token.span(), true);
            }
            case FALSE -> {
                advance();
                yield Expr.Literal.bool(token.span(), false);
            }
            case NIL -> {
                advance();
                yield Expr.Literal.nil(token.span());
            }
            case IDENTIFIER -> {
                advance();
                yield new Expr.Variable(token.span(), token.lexeme());
            }
            case LEFT_PAREN -> {
                advance();
                var inner = parseExpression();
                expect(TokenType.RIGHT_PAREN, "expected ')' after expression");
                yield new Expr.Grouping(spanFrom(token), inner);
            }
            default -> throw error(token, "expected expression");
        };
    }

    // === Token helpers ===

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token previous() {
        return tokens.get(pos - 1);
    }

    private Token advance() {
        var token = peek();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String reason) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), reason);
    }

    /**
     * Span from the start of the given token to the end of the last consumed token.
     */
    private SourceSpan spanFrom(Token start) {
        var end = pos > 0 ? previous().span().end() : start.span().end();
        return SourceSpan.of(start.span().start(), end);
    }

    /**
     * Run a production one nesting level deeper.
     *
     * @param what construct named in the error when the limit is exceeded
     */
    private <T> T nested(String what, Supplier<T> production) {
        if (depth >= MAX_NESTING_DEPTH) {
            throw error(peek(), what + " nested too deeply");
        }
        depth++;
        try {
            return production.get();
        } finally {
            depth--;
        }
    }

    private static Operator toOperator(Token token) {
        return switch (token.type()) {
            case PLUS -> Operator.PLUS;
            case MINUS -> Operator.MINUS;
            case STAR -> Operator.STAR;
            case SLASH -> Operator.SLASH;
            case BANG -> Operator.BANG;
            case EQUAL_EQUAL -> Operator.EQUAL_EQUAL;
            case BANG_EQUAL -> Operator.BANG_EQUAL;
            case GREATER -> Operator.GREATER;
            case GREATER_EQUAL -> Operator.GREATER_EQUAL;
            case LESS -> Operator.LESS;
            case LESS_EQUAL -> Operator.LESS_EQUAL;
            default -> throw new IllegalStateException("Not an operator token: " + token);
        };
    }

    private static ParseError error(Token token, String reason) {
        return new ParseError(reason, token.lexeme(), token.span());
    }

    private static ParseError unsupported(Token token) {
        return error(token, "unsupported construct");
    }
}
