package com.lux.script.parser;

/**
 * A script failure during evaluation. Aborts the current run.
 */
public class LuxRuntimeError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Operand/operator mismatch or calling a non-callable value. */
        TYPE_ERROR,
        DIVIDE_BY_ZERO,
        UNDEFINED_VARIABLE,
        ARITY_MISMATCH,
        /** A host native threw something other than a LuxRuntimeError. */
        NATIVE_FAILURE
    }

    private final Kind kind;
    private final Span span;

    public LuxRuntimeError(Kind kind, String message, Span span) {
        super(message);
        this.kind = kind;
        this.span = span;
    }

    public LuxRuntimeError(Kind kind, String message, Span span, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.span = span;
    }

    public LuxRuntimeError(Kind kind, String message) {
        this(kind, message, null);
    }

    public Kind kind() { return kind; }

    /** Span of the failing operator, name or call; null when raised outside the tree walk. */
    public Span span() { return span; }

    static LuxRuntimeError undefinedVariable(Token name) {
        return new LuxRuntimeError(Kind.UNDEFINED_VARIABLE, "Undefined variable '" + name.lexeme + "'.", name.span);
    }
}
