package com.lux.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.lux.debug.Debug;
import com.lux.script.parser.Expr.Assign;
import com.lux.script.parser.Expr.Binary;
import com.lux.script.parser.Expr.Call;
import com.lux.script.parser.Expr.ExprInterface;
import com.lux.script.parser.Expr.ExprVisitor;
import com.lux.script.parser.Expr.Grouping;
import com.lux.script.parser.Expr.Literal;
import com.lux.script.parser.Expr.Logical;
import com.lux.script.parser.Expr.Unary;
import com.lux.script.parser.Expr.Variable;
import com.lux.script.parser.Statement.Block;
import com.lux.script.parser.Statement.ExprStmt;
import com.lux.script.parser.Statement.FunctionStmt;
import com.lux.script.parser.Statement.If;
import com.lux.script.parser.Statement.PrintStmt;
import com.lux.script.parser.Statement.ReturnStmt;
import com.lux.script.parser.Statement.Stmt;
import com.lux.script.parser.Statement.StmtVisitor;
import com.lux.script.parser.Statement.VarStmt;
import com.lux.script.parser.Statement.While;

/**
 * Static pass between parsing and execution.
 *
 * Walks the tree with a stack of local scopes (name → initialized flag) and
 * tells the interpreter, for every variable read or assignment target that a
 * local scope holds, how many frames out the binding lives. Names found in no
 * local scope are globals and get no entry.
 *
 * The scopes pushed here mirror the frames the interpreter creates at run
 * time: one per block, and one for a function's parameters (its body block
 * then pushes its own).
 */
public class Resolver implements ExprVisitor<Void>, StmtVisitor<Void> {
    private static final String TAG = "lux.resolver";

    private enum FunctionType { NONE, FUNCTION }

    private final Interpreter interpreter;
    private final List<Map<String, Boolean>> scopes = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private FunctionType currentFunction = FunctionType.NONE;

    public Resolver(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    /** Resolves every statement; returns the diagnostics found (empty when the program may run). */
    public List<Diagnostic> resolve(Program program) {
        resolve(program.statements());
        Debug.get().d(TAG, "resolved " + program.statements().size() + " statements, "
                + diagnostics.size() + " diagnostics");
        return diagnostics();
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hadError() {
        return !diagnostics.isEmpty();
    }

    void resolve(List<Stmt> statements) {
        for (Stmt stmt : statements) {
            resolve(stmt);
        }
    }

    private void resolve(Stmt stmt) {
        stmt.accept(this);
    }

    private void resolve(ExprInterface expr) {
        expr.accept(this);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Void visitBlockStmt(Block stmt) {
        beginScope();
        resolve(stmt.statements);
        endScope();
        return null;
    }

    @Override
    public Void visitVarStmt(VarStmt stmt) {
        declare(stmt.name);
        resolve(stmt.initializer);
        define(stmt.name);
        return null;
    }

    @Override
    public Void visitFunctionStmt(FunctionStmt stmt) {
        // Defined before the body is resolved so the function can recurse.
        declare(stmt.name);
        define(stmt.name);
        resolveFunction(stmt);
        return null;
    }

    private void resolveFunction(FunctionStmt function) {
        FunctionType enclosing = currentFunction;
        currentFunction = FunctionType.FUNCTION;

        beginScope();
        for (Token param : function.params) {
            declare(param);
            define(param);
        }
        resolve(function.body);
        endScope();

        currentFunction = enclosing;
    }

    @Override
    public Void visitExprStmt(ExprStmt stmt) {
        resolve(stmt.expression);
        return null;
    }

    @Override
    public Void visitPrintStmt(PrintStmt stmt) {
        resolve(stmt.expression);
        return null;
    }

    @Override
    public Void visitIfStmt(If stmt) {
        resolve(stmt.condition);
        resolve(stmt.thenBranch);
        if (stmt.elseBranch != null) resolve(stmt.elseBranch);
        return null;
    }

    @Override
    public Void visitWhileStmt(While stmt) {
        resolve(stmt.condition);
        resolve(stmt.body);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt stmt) {
        if (currentFunction == FunctionType.NONE) {
            error("Can't return from top-level code.", stmt.keyword.span);
        }
        resolve(stmt.value);
        return null;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Void visitVariableExpr(Variable expr) {
        if (!scopes.isEmpty()) {
            Boolean initialized = innermost().get(expr.name.lexeme);
            if (initialized != null && !initialized) {
                error("Can't read local variable '" + expr.name.lexeme + "' in its own initializer.", expr.name.span);
            }
        }
        resolveLocal(expr, expr.name);
        return null;
    }

    @Override
    public Void visitAssignExpr(Assign expr) {
        resolve(expr.value);
        resolveLocal(expr, expr.name);
        return null;
    }

    @Override
    public Void visitBinaryExpr(Binary expr) {
        resolve(expr.left);
        resolve(expr.right);
        return null;
    }

    @Override
    public Void visitLogicalExpr(Logical expr) {
        resolve(expr.left);
        resolve(expr.right);
        return null;
    }

    @Override
    public Void visitUnaryExpr(Unary expr) {
        resolve(expr.right);
        return null;
    }

    @Override
    public Void visitGroupingExpr(Grouping expr) {
        resolve(expr.expression);
        return null;
    }

    @Override
    public Void visitCallExpr(Call expr) {
        resolve(expr.callee);
        for (ExprInterface argument : expr.arguments) {
            resolve(argument);
        }
        return null;
    }

    @Override
    public Void visitLiteralExpr(Literal expr) {
        return null;
    }

    // -------------------------
    // Scopes
    // -------------------------

    private void resolveLocal(ExprInterface expr, Token name) {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            if (scopes.get(i).containsKey(name.lexeme)) {
                interpreter.resolve(expr, scopes.size() - 1 - i);
                return;
            }
        }
        // Not found locally: global, looked up by name at run time.
    }

    private void beginScope() {
        scopes.add(new HashMap<>());
    }

    private void endScope() {
        scopes.remove(scopes.size() - 1);
    }

    private Map<String, Boolean> innermost() {
        return scopes.get(scopes.size() - 1);
    }

    private void declare(Token name) {
        if (scopes.isEmpty()) return;
        innermost().put(name.lexeme, Boolean.FALSE);
    }

    private void define(Token name) {
        if (scopes.isEmpty()) return;
        innermost().put(name.lexeme, Boolean.TRUE);
    }

    private void error(String message, Span span) {
        diagnostics.add(new Diagnostic(message, span));
    }
}
