package com.lux.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.lux.debug.Debug;
import com.lux.debug.DebugLevel;
import com.lux.debug.PrintStreamDebugSink;
import com.lux.script.config.LuxConfig;
import com.lux.script.report.ErrorReporter;
import com.lux.script.report.JsonErrorReporter;
import com.lux.script.report.TextErrorReporter;

/**
 * Command line entry point.
 *
 * <pre>
 * LuxCli run &lt;file&gt; [flags]
 * LuxCli repl [flags]
 *
 *   --config=/path/lux.json   settings file (overlays lux-defaults.json)
 *   --errors=text|json        error report format
 *   --log=OFF|TRACE|DEBUG|INFO|WARN|ERROR
 *   --prompt=STR              REPL prompt
 *   --no-echo                 REPL: don't echo expression values
 * </pre>
 *
 * Exit codes: 0 ok, 1 script error, 2 usage, 3 unreadable script or config.
 */
public final class LuxCli {
    private static final String TAG = "lux.cli";

    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    public static void main(String[] args) {
        int code = run(args, System.in, System.out, System.err);
        if (code != EXIT_OK) System.exit(code);
    }

    public static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        List<String> positional = new ArrayList<>();
        Map<String, String> flags = parseArgs(args, positional);

        if (positional.isEmpty()) {
            usage(err);
            return EXIT_USAGE;
        }
        String command = positional.get(0);

        final LuxConfig config;
        try {
            config = flags.containsKey("config") ? LuxConfig.load(Paths.get(flags.get("config"))) : LuxConfig.defaults();
            if (flags.containsKey("errors")) config.setErrorFormat(flags.get("errors"));
            if (flags.containsKey("log")) config.setLogLevel(flags.get("log"));
            if (flags.containsKey("prompt")) config.setPrompt(flags.get("prompt"));
            if (flags.containsKey("no-echo")) config.setEchoValues(false);
        } catch (UncheckedIOException e) {
            err.println(e.getMessage());
            return EXIT_IO;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        DebugLevel level = config.debugLevel();
        if (level != null) Debug.get().setSink(new PrintStreamDebugSink(err, level));
        Debug.get().d(TAG, "command=" + command + " " + config);

        ErrorReporter reporter = config.isJsonErrors() ? new JsonErrorReporter(err) : new TextErrorReporter(err);
        LuxScript engine = new LuxScript(out, reporter);

        if ("run".equals(command)) {
            if (positional.size() != 2) {
                usage(err);
                return EXIT_USAGE;
            }
            return runFile(engine, Paths.get(positional.get(1)), err);
        } else if ("repl".equals(command)) {
            if (positional.size() != 1) {
                usage(err);
                return EXIT_USAGE;
            }
            BufferedReader in = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            try {
                new LuxRepl(engine, config, in, out).loop();
            } catch (IOException e) {
                err.println("Failed to read input: " + e.getMessage());
                return EXIT_IO;
            }
            return EXIT_OK;
        }

        usage(err);
        return EXIT_USAGE;
    }

    private static int runFile(LuxScript engine, Path scriptPath, PrintStream err) {
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath);
            Debug.get().e(TAG, "read failed", e);
            return EXIT_IO;
        }

        RunResult result = engine.execute(script);
        Debug.get().i(TAG, scriptPath + " finished: " + result.status());
        return result.isOk() ? EXIT_OK : EXIT_SCRIPT_ERROR;
    }

    private static void usage(PrintStream err) {
        err.println("Usage: LuxCli run <script-file> [--config=FILE] [--errors=text|json] [--log=LEVEL]");
        err.println("       LuxCli repl [--config=FILE] [--errors=text|json] [--log=LEVEL] [--prompt=STR] [--no-echo]");
    }

    static Map<String, String> parseArgs(String[] args, List<String> positional) {
        Map<String, String> out = new HashMap<String, String>();
        for (String a : args) {
            if (a.startsWith("--") && a.indexOf('=') >= 0) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            } else {
                positional.add(a);
            }
        }
        return out;
    }

    private LuxCli() {}
}
