package com.lux.script.parser;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.lux.debug.Debug;
import com.lux.debug.DebugLevel;
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
import com.lux.script.plugins.StandardLibrary;

/**
 * Tree-walking evaluator.
 *
 * One instance keeps its globals, its closures and its resolution table across
 * {@link #run(Program)} calls, which is what lets a REPL build a program up
 * line by line. Not thread-safe and not reentrant: use one instance per
 * thread. Recursion in a script recurses on the Java stack, so a deep enough
 * script ends in {@link StackOverflowError}.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<Completion> {
    private static final String TAG = "lux.interpreter";

    private final Environment globals = new Environment();
    private final Map<ExprInterface, Integer> locals = new IdentityHashMap<>();
    private final PrintStream out;
    private Environment env = globals;

    public Interpreter() {
        this(System.out);
    }

    public Interpreter(PrintStream out) {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        this.out = out;
        StandardLibrary.load(globals);
    }

    public Environment globals() {
        return globals;
    }

    /** Called by the {@link Resolver}: {@code expr} refers to a binding {@code depth} frames out. */
    void resolve(ExprInterface expr, int depth) {
        locals.put(expr, depth);
    }

    /** Depth recorded for a Variable/Assign node, or null when it resolves as a global. */
    public Integer resolvedDepth(ExprInterface expr) {
        return locals.get(expr);
    }

    /**
     * Executes a resolved program.
     *
     * @return the value of the last statement that produced one (expression
     *         statements, possibly inside blocks or branches), or null
     * @throws LuxRuntimeError when evaluation fails; statements before the
     *         failing one keep their effects
     */
    public Value run(Program program) {
        Debug.get().d(TAG, "executing " + program.statements().size() + " statements");
        Value last = null;
        for (Stmt stmt : program.statements()) {
            Completion completion = execute(stmt);
            if (completion.value() != null) last = completion.value();
            if (completion.isReturn()) break;
        }
        return last;
    }

    // -------------------------
    // Statements
    // -------------------------

    private Completion execute(Stmt stmt) {
        return stmt.accept(this);
    }

    private Value eval(ExprInterface expr) {
        return expr.accept(this);
    }

    /** Runs {@code statements} with {@code frame} as the current environment, restoring the previous one on every exit. */
    Completion executeBlock(List<Stmt> statements, Environment frame) {
        Environment previous = this.env;
        try {
            this.env = frame;
            Completion last = Completion.normal();
            for (Stmt stmt : statements) {
                Completion completion = execute(stmt);
                if (completion.isReturn()) return completion;
                if (completion.value() != null) last = completion;
            }
            return last;
        } finally {
            this.env = previous;
        }
    }

    /** Runs a single statement with {@code frame} as the current environment. */
    Completion executeIn(Stmt stmt, Environment frame) {
        Environment previous = this.env;
        try {
            this.env = frame;
            return execute(stmt);
        } finally {
            this.env = previous;
        }
    }

    @Override
    public Completion visitExprStmt(ExprStmt stmt) {
        return Completion.normal(eval(stmt.expression));
    }

    @Override
    public Completion visitPrintStmt(PrintStmt stmt) {
        Value value = eval(stmt.expression);
        out.println(value.display());
        return Completion.normal();
    }

    @Override
    public Completion visitVarStmt(VarStmt stmt) {
        Value value = eval(stmt.initializer);
        env.define(stmt.name.lexeme, value);
        return Completion.normal();
    }

    @Override
    public Completion visitBlockStmt(Block stmt) {
        return executeBlock(stmt.statements, env.extend());
    }

    @Override
    public Completion visitIfStmt(If stmt) {
        if (eval(stmt.condition).isTruthy()) {
            return execute(stmt.thenBranch);
        } else if (stmt.elseBranch != null) {
            return execute(stmt.elseBranch);
        }
        return Completion.normal();
    }

    @Override
    public Completion visitWhileStmt(While stmt) {
        Completion last = Completion.normal();
        while (eval(stmt.condition).isTruthy()) {
            Completion completion = execute(stmt.body);
            if (completion.isReturn()) return completion;
            if (completion.value() != null) last = completion;
        }
        return last;
    }

    @Override
    public Completion visitFunctionStmt(FunctionStmt stmt) {
        UserFunction function = new UserFunction(stmt, env);
        env.define(stmt.name.lexeme, Value.callable(function));
        return Completion.normal();
    }

    @Override
    public Completion visitReturnStmt(ReturnStmt stmt) {
        return Completion.returning(eval(stmt.value));
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v == null) return Value.nil();
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        if (v instanceof Double) return Value.number((Double) v);
        if (v instanceof String) return Value.string((String) v);
        throw new IllegalStateException("Unsupported literal value: " + v);
    }

    @Override
    public Value visitGroupingExpr(Grouping expr) {
        return eval(expr.expression);
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR) {
            if (left.isTruthy()) return left;
        } else {
            if (!left.isTruthy()) return left;
        }
        return eval(expr.right);
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case BANG:
                return Value.bool(!right.isTruthy());
            case MINUS:
                if (right.getType() != Value.Type.NUMBER) {
                    throw typeError("Bad type for unary `-` operator: `" + right.typeName() + "`", expr.operator);
                }
                return Value.number(-right.asNumber());
            default:
                throw new IllegalStateException("Unsupported unary operator: " + expr.operator.type);
        }
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS:
                if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) {
                    return Value.number(left.asNumber() + right.asNumber());
                }
                if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                throw typeError("Binary `+` operator can only operate over two numbers or two strings. "
                        + "Got types `" + left.typeName() + "` and `" + right.typeName() + "`", op);
            case MINUS:
                requireNumbers(left, right, op);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumbers(left, right, op);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                requireNumbers(left, right, op);
                // == also matches -0.0
                if (right.asNumber() == 0.0) {
                    throw new LuxRuntimeError(LuxRuntimeError.Kind.DIVIDE_BY_ZERO, "Cannot divide by zero", op.span);
                }
                return Value.number(left.asNumber() / right.asNumber());

            case GREATER:
                requireComparable(left, right, op);
                return Value.bool(left.asNumber() > right.asNumber());
            case GREATER_EQUAL:
                requireComparable(left, right, op);
                return Value.bool(left.asNumber() >= right.asNumber());
            case LESS:
                requireComparable(left, right, op);
                return Value.bool(left.asNumber() < right.asNumber());
            case LESS_EQUAL:
                requireComparable(left, right, op);
                return Value.bool(left.asNumber() <= right.asNumber());

            case EQUAL_EQUAL:
                return Value.bool(left.equals(right));
            case BANG_EQUAL:
                return Value.bool(!left.equals(right));

            default:
                throw new IllegalStateException("Unsupported binary operator: " + op.type);
        }
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        Integer depth = locals.get(expr);
        Value value = (depth != null) ? env.getAt(expr.name.lexeme, depth) : globals.get(expr.name.lexeme);
        if (value == null) throw LuxRuntimeError.undefinedVariable(expr.name);
        return value;
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        Integer depth = locals.get(expr);
        boolean assigned = (depth != null)
                ? env.assignAt(expr.name.lexeme, value, depth)
                : globals.assign(expr.name.lexeme, value);
        if (!assigned) throw LuxRuntimeError.undefinedVariable(expr.name);
        return value;
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = eval(expr.callee);

        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface argument : expr.arguments) {
            args.add(eval(argument));
        }

        if (callee.getType() != Value.Type.CALLABLE) {
            throw typeError("Type `" + callee.typeName() + "` is not callable, can only call functions", expr.paren);
        }
        LuxCallable function = callee.asCallable();

        if (args.size() != function.arity()) {
            throw new LuxRuntimeError(LuxRuntimeError.Kind.ARITY_MISMATCH,
                    "Expected " + function.arity() + " arguments, but got " + args.size(), expr.paren.span);
        }

        if (Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, "call " + function + " with " + args.size() + " args");
        }
        try {
            return function.call(this, args);
        } catch (LuxRuntimeError e) {
            throw e;
        } catch (RuntimeException e) {
            if (!(function instanceof NativeFunction)) throw e;
            throw new LuxRuntimeError(LuxRuntimeError.Kind.NATIVE_FAILURE,
                    "Native function '" + function.name() + "' failed: " + e.getMessage(), expr.paren.span, e);
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static void requireNumbers(Value left, Value right, Token op) {
        if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) return;
        throw typeError("Binary `" + op.lexeme + "` operator can only operate over two numbers. "
                + "Got types `" + left.typeName() + "` and `" + right.typeName() + "`", op);
    }

    private static void requireComparable(Value left, Value right, Token op) {
        if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) return;
        throw typeError("Binary `" + op.lexeme + "` operator can only compare two numbers. "
                + "Got types `" + left.typeName() + "` and `" + right.typeName() + "`", op);
    }

    private static LuxRuntimeError typeError(String message, Token at) {
        return new LuxRuntimeError(LuxRuntimeError.Kind.TYPE_ERROR, message, at.span);
    }
}
