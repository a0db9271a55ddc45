package com.lux.script.report;

import com.lux.script.parser.Diagnostic;
import com.lux.script.parser.LineOffsets;
import com.lux.script.parser.LuxRuntimeError;

/**
 * Receives the problems of a run. Implementations must not throw: a broken
 * reporter must not take the host down with it.
 */
public interface ErrorReporter {

    /** A scan, parse or resolve problem. {@code lines} maps its span to a line. */
    void compileError(Diagnostic diagnostic, LineOffsets lines);

    /** A failure during evaluation; the run was aborted. */
    void runtimeError(LuxRuntimeError error, LineOffsets lines);
}
