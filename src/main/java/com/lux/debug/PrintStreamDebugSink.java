package com.lux.debug;

import java.io.PrintStream;

/**
 * Writes debug messages at or above a minimum level to a stream:
 *
 *   [DEBUG] lux.run: parsed 3 statements
 */
public final class PrintStreamDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel minLevel;

    public PrintStreamDebugSink(PrintStream out, DebugLevel minLevel) {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        this.out = out;
        this.minLevel = (minLevel == null) ? DebugLevel.INFO : minLevel;
    }

    public DebugLevel minLevel() { return minLevel; }

    @Override
    public boolean isEnabled(DebugLevel level) {
        return level != null && level.atLeast(minLevel);
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!isEnabled(level)) return;
        out.println("[" + level + "] " + tag + ": " + message);
        if (error != null) error.printStackTrace(out);
    }
}
