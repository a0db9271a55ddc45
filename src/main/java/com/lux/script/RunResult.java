package com.lux.script;

import java.util.Collections;
import java.util.List;

import com.lux.script.parser.Diagnostic;
import com.lux.script.parser.LuxRuntimeError;
import com.lux.script.parser.Value;

/** Outcome of {@link LuxScript#execute(String)}. */
public final class RunResult {
    public enum Status { OK, COMPILE_ERROR, RUNTIME_ERROR }

    private final Status status;
    private final Value value;
    private final List<Diagnostic> diagnostics;
    private final LuxRuntimeError error;

    private RunResult(Status status, Value value, List<Diagnostic> diagnostics, LuxRuntimeError error) {
        this.status = status;
        this.value = value;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.error = error;
    }

    static RunResult ok(Value value) {
        return new RunResult(Status.OK, value, Collections.<Diagnostic>emptyList(), null);
    }

    static RunResult compileError(List<Diagnostic> diagnostics) {
        return new RunResult(Status.COMPILE_ERROR, null, diagnostics, null);
    }

    static RunResult runtimeError(LuxRuntimeError error) {
        return new RunResult(Status.RUNTIME_ERROR, null, Collections.<Diagnostic>emptyList(), error);
    }

    public Status status() { return status; }
    public boolean isOk() { return status == Status.OK; }

    /** Last produced value; null when nothing produced one or the run failed. */
    public Value value() { return value; }

    /** Scan, parse or resolve problems; empty unless status is COMPILE_ERROR. */
    public List<Diagnostic> diagnostics() { return diagnostics; }

    /** The failure that aborted execution; null unless status is RUNTIME_ERROR. */
    public LuxRuntimeError error() { return error; }
}
