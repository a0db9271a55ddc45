package com.lux.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide logging hub used by the scanner, resolver, interpreter and CLI.
 *
 * Messages go to the installed {@link DebugSink}. Until one is installed, or
 * after {@code setSink(null)}, they are dropped. Callers that build expensive
 * messages should check {@link #isEnabled(DebugLevel)} first.
 */
public final class Debug {

    private static final DebugSink DISCARD = new DebugSink() {
        @Override
        public void log(DebugLevel level, String tag, String message, Throwable error) {
        }

        @Override
        public boolean isEnabled(DebugLevel level) {
            return false;
        }
    };

    // must follow DISCARD: static fields initialise in declaration order
    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sink = new AtomicReference<>(DISCARD);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs {@code sink}; {@code null} restores the discarding default. */
    public void setSink(DebugSink sink) {
        this.sink.set(sink == null ? DISCARD : sink);
    }

    public DebugSink getSink() {
        return sink.get();
    }

    public boolean isEnabled(DebugLevel level) {
        return sink.get().isEnabled(level);
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sink.get().log(level, tag, message, error);
    }
}
