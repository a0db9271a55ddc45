package com.lux.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.lux.script.parser.Expr.Assign;
import com.lux.script.parser.Expr.Binary;
import com.lux.script.parser.Expr.Call;
import com.lux.script.parser.Expr.ExprInterface;
import com.lux.script.parser.Expr.Grouping;
import com.lux.script.parser.Expr.Literal;
import com.lux.script.parser.Expr.Logical;
import com.lux.script.parser.Expr.Unary;
import com.lux.script.parser.Expr.Variable;
import com.lux.script.parser.Statement.Block;
import com.lux.script.parser.Statement.ExprStmt;
import com.lux.script.parser.Statement.FunctionStmt;
import com.lux.script.parser.Statement.Stmt;
import com.lux.script.parser.Statement.While;

/**
 * Recursive-descent parser.
 *
 * Syntax errors never throw: each one is recorded as a {@link Diagnostic} and
 * the failing rule returns {@code null}, which every caller propagates. The
 * cursor only ever moves forward.
 *
 * <pre>
 * expression  → assignment
 * assignment  → IDENTIFIER "=" assignment | logic_or
 * logic_or    → logic_and ( "or" logic_and )*
 * logic_and   → equality ( "and" equality )*
 * equality    → comparison ( ("!="|"==") comparison )*
 * comparison  → term ( (">"|">="|"<"|"<=") term )*
 * term        → factor ( ("-"|"+") factor )*
 * factor      → unary ( ("/"|"*") unary )*
 * unary       → ("!"|"-") unary | call
 * call        → primary ( "(" arguments? ")" )*
 * primary     → NUMBER | STRING | "true" | "false" | "nil"
 *             | "(" expression ")" | IDENTIFIER
 * </pre>
 */
public class Parser {
    static final int MAX_ARGUMENTS = 255;

    private final List<Token> tokens;
    private final Token eof;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int current = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
        int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).span.end;
        this.eof = new Token(TokenType.EOF, "", null, new Span(end, end));
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hadError() {
        return !diagnostics.isEmpty();
    }

    // -------------------------
    // Declarations & statements
    // -------------------------

    /** declaration → "fun" function | "var" IDENTIFIER ("=" expression)? ";" | statement */
    public Stmt declaration() {
        if (is(TokenType.FUN)) return functionDeclaration();
        if (is(TokenType.VAR)) return varDeclaration();
        return statement();
    }

    private Stmt functionDeclaration() {
        Token name = expect(TokenType.IDENTIFIER);
        if (name == null) return null;
        if (expect(TokenType.LEFT_PAREN) == null) return null;

        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_ARGUMENTS) {
                    error("Can't have more than " + MAX_ARGUMENTS + " parameters.", peek().span);
                }
                Token param = expect(TokenType.IDENTIFIER);
                if (param == null) return null;
                params.add(param);
            } while (is(TokenType.COMMA));
        }
        if (expect(TokenType.RIGHT_PAREN) == null) return null;

        Stmt body = block();
        if (body == null) return null;
        return new FunctionStmt(name, params, body);
    }

    private Stmt varDeclaration() {
        Token name = expect(TokenType.IDENTIFIER);
        if (name == null) return null;

        ExprInterface initializer = new Literal(null);
        if (is(TokenType.EQUAL)) {
            initializer = expression();
            if (initializer == null) return null;
        }
        if (expect(TokenType.SEMICOLON) == null) return null;
        return new Statement.VarStmt(name, initializer);
    }

    private Stmt statement() {
        if (check(TokenType.FOR)) return forStatement();
        if (check(TokenType.IF)) return ifStatement();
        if (is(TokenType.PRINT)) return printStatement();
        if (is(TokenType.RETURN)) return returnStatement();
        if (check(TokenType.WHILE)) return whileStatement();
        if (check(TokenType.LEFT_BRACE)) return block();
        return exprStatement();
    }

    private Stmt printStatement() {
        ExprInterface value = expression();
        if (value == null) return null;
        if (expect(TokenType.SEMICOLON) == null) return null;
        return new Statement.PrintStmt(value);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        ExprInterface value = new Literal(null);
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
            if (value == null) return null;
        }
        if (expect(TokenType.SEMICOLON) == null) return null;
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt ifStatement() {
        expect(TokenType.IF);
        if (expect(TokenType.LEFT_PAREN) == null) return null;
        ExprInterface condition = expression();
        if (condition == null) return null;
        if (expect(TokenType.RIGHT_PAREN) == null) return null;

        Stmt thenBranch = statement();
        if (thenBranch == null) return null;
        Stmt elseBranch = null;
        if (is(TokenType.ELSE)) {
            elseBranch = statement();
            if (elseBranch == null) return null;
        }
        return new Statement.If(condition, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        expect(TokenType.WHILE);
        if (expect(TokenType.LEFT_PAREN) == null) return null;
        ExprInterface condition = expression();
        if (condition == null) return null;
        if (expect(TokenType.RIGHT_PAREN) == null) return null;

        Stmt body = statement();
        if (body == null) return null;
        return new While(condition, body);
    }

    // for (init; cond; inc) body
    // => { init; while (cond) { body; inc; } }
    private Stmt forStatement() {
        expect(TokenType.FOR);
        if (expect(TokenType.LEFT_PAREN) == null) return null;

        // initializer
        Stmt initializer;
        if (is(TokenType.SEMICOLON)) {
            initializer = null;
        } else if (is(TokenType.VAR)) {
            initializer = varDeclaration(); // consumes first ';'
            if (initializer == null) return null;
        } else {
            initializer = exprStatement();  // consumes first ';'
            if (initializer == null) return null;
        }

        // condition
        ExprInterface condition = null;
        if (!check(TokenType.SEMICOLON)) {
            condition = expression();
            if (condition == null) return null;
        }
        if (expect(TokenType.SEMICOLON) == null) return null;

        // increment
        ExprInterface increment = null;
        if (!check(TokenType.RIGHT_PAREN)) {
            increment = expression();
            if (increment == null) return null;
        }
        if (expect(TokenType.RIGHT_PAREN) == null) return null;

        Stmt body = statement();
        if (body == null) return null;

        if (increment != null) {
            List<Stmt> list = new ArrayList<>();
            list.add(body);
            list.add(new ExprStmt(increment));
            body = new Block(list);
        }

        if (condition == null) condition = new Literal(Boolean.TRUE);
        body = new While(condition, body);

        if (initializer != null) {
            List<Stmt> list = new ArrayList<>();
            list.add(initializer);
            list.add(body);
            body = new Block(list);
        }

        return body;
    }

    /**
     * block → "{" declaration* "}"
     *
     * A broken declaration inside the block is skipped up to its ';' (or the
     * closing brace) so the rest of the block, and the statement around it,
     * still parse. The diagnostic it left keeps the program from running.
     */
    private Stmt block() {
        if (expect(TokenType.LEFT_BRACE) == null) return null;

        List<Stmt> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            Stmt stmt = declaration();
            if (stmt != null) {
                statements.add(stmt);
            } else {
                synchronizeInBlock();
            }
        }
        if (expect(TokenType.RIGHT_BRACE) == null) return null;
        return new Block(statements);
    }

    private Stmt exprStatement() {
        ExprInterface expr = expression();
        if (expr == null) return null;
        if (expect(TokenType.SEMICOLON) == null) return null;
        return new ExprStmt(expr);
    }

    // -------------------------
    // Recovery
    // -------------------------

    /** Discards tokens up to and including the next ';', or to the end of input. */
    public void synchronize() {
        while (!isAtEnd()) {
            if (is(TokenType.SEMICOLON)) return;
            advance();
        }
    }

    private void synchronizeInBlock() {
        while (!isAtEnd() && !check(TokenType.RIGHT_BRACE)) {
            if (is(TokenType.SEMICOLON)) return;
            advance();
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    public ExprInterface expression() { return assignment(); }

    private ExprInterface assignment() {
        ExprInterface expr = or();
        if (expr == null) return null;

        if (is(TokenType.EQUAL)) {
            Token equals = previous();
            ExprInterface value = assignment();
            if (value == null) return null;
            if (expr instanceof Variable) {
                Token name = ((Variable) expr).name;
                return new Assign(name, value);
            }
            // Reported, but the statement around it still parses.
            error("Invalid assignment target.", equals.span);
        }
        return expr;
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        if (expr == null) return null;
        while (is(TokenType.OR)) {
            Token op = previous();
            ExprInterface right = and();
            if (right == null) return null;
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = equality();
        if (expr == null) return null;
        while (is(TokenType.AND)) {
            Token op = previous();
            ExprInterface right = equality();
            if (right == null) return null;
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprInterface equality() {
        ExprInterface expr = comparison();
        if (expr == null) return null;
        while (oneOf(TokenType.BANG_EQUAL, TokenType.EQUAL_EQUAL)) {
            Token op = previous();
            ExprInterface right = comparison();
            if (right == null) return null;
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface comparison() {
        ExprInterface expr = term();
        if (expr == null) return null;
        while (oneOf(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            ExprInterface right = term();
            if (right == null) return null;
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface term() {
        ExprInterface expr = factor();
        if (expr == null) return null;
        while (oneOf(TokenType.MINUS, TokenType.PLUS)) {
            Token op = previous();
            ExprInterface right = factor();
            if (right == null) return null;
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface factor() {
        ExprInterface expr = unary();
        if (expr == null) return null;
        while (oneOf(TokenType.SLASH, TokenType.STAR)) {
            Token op = previous();
            ExprInterface right = unary();
            if (right == null) return null;
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (oneOf(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            ExprInterface right = unary();
            if (right == null) return null;
            return new Unary(op, right);
        }
        return call();
    }

    private ExprInterface call() {
        ExprInterface expr = primary();
        while (expr != null && is(TokenType.LEFT_PAREN)) {
            expr = finishCall(expr);
        }
        return expr;
    }

    private ExprInterface finishCall(ExprInterface callee) {
        List<ExprInterface> arguments = new ArrayList<>();

        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (arguments.size() >= MAX_ARGUMENTS) {
                    error("Can't have more than " + MAX_ARGUMENTS + " arguments.", peek().span);
                }
                ExprInterface arg = expression();
                if (arg == null) return null;
                arguments.add(arg);
            } while (is(TokenType.COMMA));
        }

        Token paren = expect(TokenType.RIGHT_PAREN);
        if (paren == null) return null;
        return new Call(callee, paren, arguments);
    }

    private ExprInterface primary() {
        if (is(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (is(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (is(TokenType.NIL)) return new Literal(null);
        if (is(TokenType.NUMBER)) return new Literal(previous().literal);
        if (is(TokenType.STRING)) return new Literal(previous().literal);
        if (is(TokenType.IDENTIFIER)) return new Variable(previous());

        if (is(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            if (expr == null) return null;
            if (expect(TokenType.RIGHT_PAREN) == null) return null;
            return new Grouping(expr);
        }

        Token token = peek();
        if (token.type == TokenType.UNTERMINATED_STRING) {
            advance();
            error("Unterminated string.", token.span);
            return null;
        }
        if (token.type == TokenType.UNKNOWN_CHAR) {
            advance();
            error("Unexpected character '" + token.lexeme + "'.", token.span);
            return null;
        }

        error("Expected one of true, false, nil, number, string, identifier, or ( but found " + token, token.span);
        return null;
    }

    // -------------------------
    // Primitives
    // -------------------------

    /** Consumes the first of {@code types} that matches the current token. */
    private boolean oneOf(TokenType... types) {
        for (TokenType type : types) {
            if (is(type)) return true;
        }
        return false;
    }

    private boolean is(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /** Advance-or-error: returns the consumed token, or null after recording a diagnostic. */
    private Token expect(TokenType type) {
        if (check(type)) return advance();
        Token found = peek();
        error("Expected " + type + " got " + found, found.span);
        return null;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    public boolean isAtEnd() { return current >= tokens.size(); }
    private Token peek() { return isAtEnd() ? eof : tokens.get(current); }
    private Token previous() { return current == 0 ? eof : tokens.get(current - 1); }

    private void error(String message, Span span) {
        diagnostics.add(new Diagnostic(message, span));
    }
}
