package com.lux.script.parser;

import java.util.List;

import com.lux.script.parser.Statement.FunctionStmt;

/**
 * A script function paired with the environment that was current where it
 * was declared.
 */
public final class UserFunction extends LuxCallable {
    final FunctionStmt declaration;
    final Environment closure;

    UserFunction(FunctionStmt declaration, Environment closure) {
        this.declaration = declaration;
        this.closure = closure;
    }

    @Override
    public String name() { return declaration.name.lexeme; }

    @Override
    public int arity() { return declaration.params.size(); }

    @Override
    Value call(Interpreter interpreter, List<Value> args) {
        // New call frame is a child of the closure (lexical scoping),
        // not a child of the caller's environment.
        Environment frame = closure.extend();
        for (int i = 0; i < declaration.params.size(); i++) {
            frame.define(declaration.params.get(i).lexeme, args.get(i));
        }

        Completion completion = interpreter.executeIn(declaration.body, frame);
        return completion.isReturn() ? completion.value() : Value.nil();
    }

    @Override
    public String toString() {
        return "<fun " + name() + ">";
    }
}
