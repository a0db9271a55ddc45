package com.lux.script.report;

import java.io.PrintStream;

import com.lux.script.parser.Diagnostic;
import com.lux.script.parser.LineOffsets;
import com.lux.script.parser.LuxRuntimeError;
import com.lux.script.parser.Span;

/**
 * Human readable reporting:
 *
 *   [line 3] Error: Invalid assignment target.
 *   [line 7] Runtime error: Cannot divide by zero
 */
public final class TextErrorReporter implements ErrorReporter {
    private final PrintStream err;

    public TextErrorReporter() {
        this(System.err);
    }

    public TextErrorReporter(PrintStream err) {
        if (err == null) throw new IllegalArgumentException("err must not be null");
        this.err = err;
    }

    @Override
    public void compileError(Diagnostic diagnostic, LineOffsets lines) {
        err.println(prefix(diagnostic.span, lines) + "Error: " + diagnostic.message);
    }

    @Override
    public void runtimeError(LuxRuntimeError error, LineOffsets lines) {
        err.println(prefix(error.span(), lines) + "Runtime error: " + error.getMessage());
    }

    static String prefix(Span span, LineOffsets lines) {
        int line = lineOf(span, lines);
        return (line > 0) ? "[line " + line + "] " : "";
    }

    /** 1-indexed line of {@code span}, or 0 when it cannot be placed. */
    static int lineOf(Span span, LineOffsets lines) {
        if (span == null || lines == null) return 0;
        try {
            return lines.line(span.start);
        } catch (IllegalArgumentException e) {
            return 0;
        }
    }
}
