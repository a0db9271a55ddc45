package com.lux.script.plugins;

import com.lux.script.parser.Environment;
import com.lux.script.parser.Value;

/**
 * StandardLibrary
 *
 * Natives every interpreter starts with, bound in the global frame.
 *
 * Scripts:
 *   var start = clock();
 *   ...
 *   print clock() - start;
 */
public final class StandardLibrary {

    private StandardLibrary() {}

    public static void load(Environment globals) {
        // Milliseconds since the UNIX epoch.
        globals.define("clock", Value.nativeFunction("clock", 0,
                args -> Value.number((double) System.currentTimeMillis())));
    }
}
