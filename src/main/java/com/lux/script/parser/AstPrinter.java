package com.lux.script.parser;

import java.util.List;

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
 * Renders a tree as parenthesised prefix text, e.g. {@code (+ 1 (* 2 3))}.
 * Debug output only; the format is not parsed back.
 */
public final class AstPrinter implements ExprVisitor<String>, StmtVisitor<String> {

    public String print(ExprInterface expr) {
        return expr.accept(this);
    }

    public String print(Stmt stmt) {
        return stmt.accept(this);
    }

    public String print(List<Stmt> statements) {
        StringBuilder sb = new StringBuilder();
        for (Stmt stmt : statements) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(print(stmt));
        }
        return sb.toString();
    }

    @Override
    public String visitLiteralExpr(Literal expr) {
        if (expr.value == null) return "nil";
        if (expr.value instanceof Double) return Value.formatNumber((Double) expr.value);
        if (expr.value instanceof String) return '"' + (String) expr.value + '"';
        return expr.value.toString();
    }

    @Override
    public String visitGroupingExpr(Grouping expr) {
        return parenthesize("group", expr.expression);
    }

    @Override
    public String visitUnaryExpr(Unary expr) {
        return parenthesize(expr.operator.lexeme, expr.right);
    }

    @Override
    public String visitBinaryExpr(Binary expr) {
        return parenthesize(expr.operator.lexeme, expr.left, expr.right);
    }

    @Override
    public String visitLogicalExpr(Logical expr) {
        return parenthesize(expr.operator.lexeme, expr.left, expr.right);
    }

    @Override
    public String visitVariableExpr(Variable expr) {
        return expr.name.lexeme;
    }

    @Override
    public String visitAssignExpr(Assign expr) {
        return parenthesize("= " + expr.name.lexeme, expr.value);
    }

    @Override
    public String visitCallExpr(Call expr) {
        StringBuilder sb = new StringBuilder("(call ").append(print(expr.callee));
        for (ExprInterface arg : expr.arguments) {
            sb.append(' ').append(print(arg));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitExprStmt(ExprStmt stmt) {
        return parenthesize(";", stmt.expression);
    }

    @Override
    public String visitPrintStmt(PrintStmt stmt) {
        return parenthesize("print", stmt.expression);
    }

    @Override
    public String visitVarStmt(VarStmt stmt) {
        return parenthesize("var " + stmt.name.lexeme, stmt.initializer);
    }

    @Override
    public String visitBlockStmt(Block stmt) {
        StringBuilder sb = new StringBuilder("(block");
        for (Stmt s : stmt.statements) {
            sb.append(' ').append(print(s));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitIfStmt(If stmt) {
        StringBuilder sb = new StringBuilder("(if ")
                .append(print(stmt.condition)).append(' ')
                .append(print(stmt.thenBranch));
        if (stmt.elseBranch != null) sb.append(' ').append(print(stmt.elseBranch));
        return sb.append(')').toString();
    }

    @Override
    public String visitWhileStmt(While stmt) {
        return "(while " + print(stmt.condition) + " " + print(stmt.body) + ")";
    }

    @Override
    public String visitFunctionStmt(FunctionStmt stmt) {
        StringBuilder sb = new StringBuilder("(fun ").append(stmt.name.lexeme).append(" (");
        for (int i = 0; i < stmt.params.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(stmt.params.get(i).lexeme);
        }
        return sb.append(") ").append(print(stmt.body)).append(')').toString();
    }

    @Override
    public String visitReturnStmt(ReturnStmt stmt) {
        return parenthesize("return", stmt.value);
    }

    private String parenthesize(String name, ExprInterface... exprs) {
        StringBuilder sb = new StringBuilder("(").append(name);
        for (ExprInterface expr : exprs) {
            sb.append(' ').append(print(expr));
        }
        return sb.append(')').toString();
    }
}
