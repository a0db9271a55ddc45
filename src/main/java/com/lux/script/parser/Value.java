package com.lux.script.parser;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Runtime value: nil, boolean, number (double), string or callable.
 *
 * Equality is structural for the first four types and identity for callables,
 * so two separately declared functions never compare equal.
 */
public class Value {
    public enum Type { NIL, BOOL, NUMBER, STRING, CALLABLE }

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NIL; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }

    public static Value string(String s) {
        if (s == null) throw new IllegalArgumentException("string value must not be null");
        return new Value(Type.STRING, s);
    }

    public static Value callable(LuxCallable c) {
        if (c == null) throw new IllegalArgumentException("callable must not be null");
        return new Value(Type.CALLABLE, c);
    }

    public static Value nativeFunction(String name, int arity, NativeFunction.BuiltinFunction fn) {
        return callable(new NativeFunction(name, arity, fn));
    }

    public Type getType() { return type; }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected boolean, got " + typeName());
        return (Boolean) value;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + typeName());
        return (Double) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + typeName());
        return (String) value;
    }

    public LuxCallable asCallable() {
        if (type != Type.CALLABLE) throw new IllegalStateException("Expected callable, got " + typeName());
        return (LuxCallable) value;
    }

    /** Only nil and false are falsy; 0 and "" are truthy. */
    public boolean isTruthy() {
        switch (type) {
            case NIL: return false;
            case BOOL: return (Boolean) value;
            default: return true;
        }
    }

    public String typeName() {
        switch (type) {
            case NIL: return "nil";
            case BOOL: return "boolean";
            case NUMBER: return "number";
            case STRING: return "string";
            default: return "callable";
        }
    }

    /** The form written by {@code print}: strings are unquoted. */
    public String display() {
        switch (type) {
            case NIL:
                return "nil";
            case BOOL:
                return value.toString();
            case NUMBER:
                return formatNumber((Double) value);
            case STRING:
                return (String) value;
            default:
                return value.toString();
        }
    }

    static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.floor(d)) return String.format(Locale.ROOT, "%.0f", d);
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case NIL:
                return true;
            case NUMBER:
                return ((Double) value).doubleValue() == ((Double) other.value).doubleValue();
            case CALLABLE:
                return value == other.value;
            default:
                return value.equals(other.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NIL:
                return 0;
            case NUMBER: {
                double d = (Double) value;
                return Double.hashCode(d == 0.0 ? 0.0 : d);
            }
            case CALLABLE:
                return System.identityHashCode(value);
            default:
                return value.hashCode();
        }
    }

    /** Debug form used by the REPL echo: like {@link #display()} but strings are quoted. */
    @Override
    public String toString() {
        if (type == Type.STRING) return '"' + (String) value + '"';
        return display();
    }
}
