package com.lux.script.parser;

/**
 * How a statement finished: normally (optionally leaving a value for the REPL
 * to echo) or by executing {@code return}. Runtime errors travel separately as
 * {@link LuxRuntimeError}.
 */
public final class Completion {
    public enum Kind { NORMAL, RETURN }

    private static final Completion EMPTY = new Completion(Kind.NORMAL, null);

    private final Kind kind;
    private final Value value;

    private Completion(Kind kind, Value value) {
        this.kind = kind;
        this.value = value;
    }

    public static Completion normal() { return EMPTY; }

    public static Completion normal(Value value) {
        return (value == null) ? EMPTY : new Completion(Kind.NORMAL, value);
    }

    public static Completion returning(Value value) {
        return new Completion(Kind.RETURN, (value == null) ? Value.nil() : value);
    }

    public Kind kind() { return kind; }
    public boolean isReturn() { return kind == Kind.RETURN; }

    /** The produced value, or null when a normal completion left none. */
    public Value value() { return value; }
}
