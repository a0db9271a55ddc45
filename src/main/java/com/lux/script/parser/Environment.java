package com.lux.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One lexical scope frame plus a link to its enclosing frame.
 *
 * Frames are shared: the interpreter's current pointer, child frames and every
 * closure that captured a frame all reference it, and the frame lives as long
 * as any of them does. A parent is always an older, outer frame, so chains
 * never form cycles.
 */
public class Environment {
    private final Environment parent;
    private final Map<String, Value> values = new LinkedHashMap<>();

    /** A root (global) frame. */
    public Environment() {
        this.parent = null;
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    /** A new frame whose parent is this one. */
    public Environment extend() {
        return new Environment(this);
    }

    public Environment parent() {
        return parent;
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Inserts or overwrites in this frame only. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    /** Nearest binding walking outward, or null when no frame has the name. */
    public Value get(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.values.get(name);
            if (v != null) return v;
        }
        return null;
    }

    /** Updates the nearest frame that binds {@code name}; false when none does. */
    public boolean assign(String name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) {
                e.values.put(name, value);
                return true;
            }
        }
        return false;
    }

    /** Frame-local read in the ancestor exactly {@code depth} links out. */
    public Value getAt(String name, int depth) {
        Environment target = ancestor(depth);
        return (target == null) ? null : target.values.get(name);
    }

    /** Frame-local write in the ancestor exactly {@code depth} links out. */
    public boolean assignAt(String name, Value value, int depth) {
        Environment target = ancestor(depth);
        if (target == null || !target.values.containsKey(name)) return false;
        target.values.put(name, value);
        return true;
    }

    public Environment ancestor(int depth) {
        Environment e = this;
        for (int i = 0; i < depth && e != null; i++) {
            e = e.parent;
        }
        return e;
    }

    /** Names bound in this frame, in definition order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }
}
