package com.lux.script.parser;

/** A compile-time (scan, parse or resolve) problem: message plus source span. */
public final class Diagnostic {
    public final String message;
    public final Span span;

    public Diagnostic(String message, Span span) {
        this.message = message;
        this.span = (span == null) ? Span.EMPTY : span;
    }

    @Override
    public String toString() {
        return message + " at " + span;
    }
}
