package com.lux.script;

import java.io.PrintStream;
import java.util.List;

import com.lux.debug.Debug;
import com.lux.debug.DebugLevel;
import com.lux.script.parser.AstPrinter;
import com.lux.script.parser.Diagnostic;
import com.lux.script.parser.Interpreter;
import com.lux.script.parser.LineOffsets;
import com.lux.script.parser.LuxRuntimeError;
import com.lux.script.parser.NativeFunction;
import com.lux.script.parser.Program;
import com.lux.script.parser.Resolver;
import com.lux.script.parser.Value;
import com.lux.script.report.ErrorReporter;
import com.lux.script.report.TextErrorReporter;

/**
 * Lux script engine.
 *
 * Language:
 * - Values: nil, boolean, number (double), string, function
 * - Statements: var, print, blocks, if/else, while, for, fun, return
 * - Expressions: arithmetic, comparison, equality, and/or (short-circuit),
 *   assignment, calls (callee may be any expression: f()())
 * - Functions are closures over the scope they were declared in
 * - Only nil and false are falsy
 *
 * Pipeline per run: scan → parse → resolve → execute. Nothing executes when
 * any scan, parse or resolve diagnostic exists. Globals, functions and
 * resolution data persist across runs on the same engine.
 *
 * Usage:
 *   LuxScript engine = new LuxScript();
 *   engine.registerFunction("twice", 1, args -> Value.number(2 * args.get(0).asNumber()));
 *   Value v = engine.run("twice(21);");   // 42
 */
public class LuxScript {
    private static final String TAG = "lux.run";

    private final Interpreter interpreter;
    private final ErrorReporter reporter;

    public LuxScript() {
        this(System.out, new TextErrorReporter());
    }

    public LuxScript(PrintStream out, ErrorReporter reporter) {
        if (reporter == null) throw new IllegalArgumentException("reporter must not be null");
        this.interpreter = new Interpreter(out);
        this.reporter = reporter;
    }

    /** Binds a host function in the global scope. Replaces any existing global of that name. */
    public void registerFunction(String name, int arity, NativeFunction.BuiltinFunction fn) {
        interpreter.globals().define(name, Value.nativeFunction(name, arity, fn));
        Debug.get().d(TAG, "registered native " + name + "/" + arity);
    }

    public Interpreter interpreter() {
        return interpreter;
    }

    /** Runs {@code source}; returns the last produced value, or null on no value or any error. */
    public Value run(String source) {
        return execute(source).value();
    }

    public RunResult execute(String source) {
        return execute(source, interpreter, reporter);
    }

    /**
     * Library entry point: scan, parse, resolve and execute {@code source} on
     * an existing interpreter. Problems go to {@code reporter}; nothing is
     * thrown for script errors.
     *
     * @return the last produced value, or null
     */
    public static Value run(String source, Interpreter interpreter, ErrorReporter reporter) {
        return execute(source, interpreter, reporter).value();
    }

    static RunResult execute(String source, Interpreter interpreter, ErrorReporter reporter) {
        if (source == null) throw new IllegalArgumentException("source must not be null");

        LineOffsets lines = new LineOffsets(source);
        Program program = Program.parse(source);
        if (program.hasErrors()) {
            return compileFailed(program.diagnostics(), lines, reporter);
        }
        Debug.get().d(TAG, "parsed " + program.statements().size() + " statements");
        if (Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, new AstPrinter().print(program.statements()));
        }

        List<Diagnostic> resolveErrors = new Resolver(interpreter).resolve(program);
        if (!resolveErrors.isEmpty()) {
            return compileFailed(resolveErrors, lines, reporter);
        }

        try {
            return RunResult.ok(interpreter.run(program));
        } catch (LuxRuntimeError e) {
            Debug.get().d(TAG, "runtime error (" + e.kind() + "): " + e.getMessage());
            reporter.runtimeError(e, lines);
            return RunResult.runtimeError(e);
        }
    }

    private static RunResult compileFailed(List<Diagnostic> diagnostics, LineOffsets lines, ErrorReporter reporter) {
        Debug.get().d(TAG, diagnostics.size() + " compile error(s), not executing");
        for (Diagnostic d : diagnostics) {
            reporter.compileError(d, lines);
        }
        return RunResult.compileError(diagnostics);
    }
}
