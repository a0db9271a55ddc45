package com.lux.debug;

/** Pluggable debug output target (stderr, file, test collector, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);

    /** Whether a message at {@code level} would be kept. Sinks that filter override this. */
    default boolean isEnabled(DebugLevel level) {
        return true;
    }
}
