package com.lux.script.parser;

/**
 * Half-open UTF-8 byte range [start, end) into the source text.
 */
public final class Span {
    public static final Span EMPTY = new Span(0, 0);

    public final int start;
    public final int end;

    public Span(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span other = (Span) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() { return 31 * start + end; }

    @Override
    public String toString() { return "[" + start + ", " + end + ")"; }
}
