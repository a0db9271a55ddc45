package com.lux.script.parser;

import java.util.List;

/**
 * Something a script can call. The set of kinds is closed: host natives
 * ({@link NativeFunction}) and script closures ({@link UserFunction}).
 */
public abstract class LuxCallable {

    LuxCallable() {}

    public abstract String name();

    public abstract int arity();

    /** Arity has already been checked by the caller. */
    abstract Value call(Interpreter interpreter, List<Value> args);
}
