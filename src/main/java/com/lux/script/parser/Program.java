package com.lux.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.lux.script.parser.Statement.Stmt;

/**
 * Parse entry point: the statements of a source text, or the diagnostics
 * that stopped it from being runnable.
 */
public final class Program {
    private final List<Stmt> statements;
    private final List<Diagnostic> diagnostics;

    private Program(List<Stmt> statements, List<Diagnostic> diagnostics) {
        this.statements = Collections.unmodifiableList(statements);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public static Program parse(List<Token> tokens) {
        Parser parser = new Parser(tokens);
        List<Stmt> statements = new ArrayList<>();

        while (!parser.isAtEnd()) {
            Stmt stmt = parser.declaration();
            if (stmt != null) {
                statements.add(stmt);
            } else {
                // Skip the rest of the broken statement and keep looking for more errors.
                parser.synchronize();
            }
        }

        return new Program(statements, new ArrayList<>(parser.diagnostics()));
    }

    public static Program parse(String source) {
        return parse(new Lexer(source).tokenize());
    }

    public List<Stmt> statements() { return statements; }
    public List<Diagnostic> diagnostics() { return diagnostics; }
    public boolean hasErrors() { return !diagnostics.isEmpty(); }
}
