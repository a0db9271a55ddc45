package com.lux.script.parser;

import java.util.Collections;
import java.util.List;

/** A fixed-arity function implemented by the host. */
public final class NativeFunction extends LuxCallable {

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final String name;
    private final int arity;
    private final BuiltinFunction fn;

    NativeFunction(String name, int arity, BuiltinFunction fn) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("name must not be empty");
        if (arity < 0) throw new IllegalArgumentException("arity must not be negative");
        if (fn == null) throw new IllegalArgumentException("fn must not be null");
        this.name = name;
        this.arity = arity;
        this.fn = fn;
    }

    @Override
    public String name() { return name; }

    @Override
    public int arity() { return arity; }

    @Override
    Value call(Interpreter interpreter, List<Value> args) {
        Value result = fn.call(Collections.unmodifiableList(args));
        return (result == null) ? Value.nil() : result;
    }

    @Override
    public String toString() {
        return "<fun (native) " + name + ">";
    }
}
