package com.lux.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

import com.lux.debug.Debug;
import com.lux.script.config.LuxConfig;
import com.lux.script.parser.Environment;
import com.lux.script.parser.Value;

/**
 * Line-at-a-time shell over one {@link LuxScript} engine, so declarations
 * from earlier lines stay visible to later ones.
 *
 * Commands start with ':' and are not passed to the engine.
 */
public final class LuxRepl {
    private static final String TAG = "lux.repl";

    private final LuxScript engine;
    private final LuxConfig config;
    private final BufferedReader in;
    private final PrintStream out;

    public LuxRepl(LuxScript engine, LuxConfig config, BufferedReader in, PrintStream out) {
        this.engine = engine;
        this.config = config;
        this.in = in;
        this.out = out;
    }

    /** Reads until EOF or {@code :quit}. */
    public void loop() throws IOException {
        out.println("Lux REPL. Type :help for commands.");
        while (true) {
            out.print(config.getPrompt());
            out.flush();
            String line = in.readLine();
            if (line == null) break; // EOF
            if (!handle(line)) break;
        }
        Debug.get().d(TAG, "session ended");
    }

    /**
     * Handles one input line.
     *
     * @return false when the session should end
     */
    boolean handle(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return true;

        if (trimmed.startsWith(":")) {
            return command(trimmed.substring(1).trim().toLowerCase(Locale.ROOT));
        }

        RunResult result = engine.execute(line);
        Value value = result.value();
        if (result.isOk() && value != null && config.isEchoValues()) {
            out.println(value);
        }
        return true;
    }

    private boolean command(String cmd) {
        if ("quit".equals(cmd) || "q".equals(cmd)) {
            return false;

        } else if ("help".equals(cmd)) {
            printHelp();

        } else if ("env".equals(cmd)) {
            Environment globals = engine.interpreter().globals();
            for (String name : globals.names()) {
                out.println(name + " = " + globals.get(name));
            }

        } else {
            out.println("Unknown command :" + cmd + " (try :help)");
        }
        return true;
    }

    private void printHelp() {
        out.println("Enter Lux statements, e.g.  var x = 1 + 2;  or  x * 2;");
        out.println("Expression results are echoed.");
        out.println("  :env   list global bindings");
        out.println("  :help  show this help");
        out.println("  :quit  leave");
    }
}
