import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.lux.debug.Debug;
import com.lux.debug.DebugLevel;
import com.lux.debug.PrintStreamDebugSink;
import com.lux.script.LuxScript;

public class DebugTest {

    @AfterEach
    void resetSink() {
        Debug.get().setSink(null);
    }

    @Test
    void pipelineLogsUnderItsTags() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(level + " " + tag + ": " + message));

        LuxScript engine = new LuxScript(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
                new CollectingErrorReporter());
        engine.run("fun f(a) { return a; } f(1);");

        assertTrue(seen.contains("DEBUG lux.run: parsed 2 statements"), seen.toString());
        assertTrue(seen.contains("TRACE lux.run: (fun f (a) (block (return a)))\n(; (call f 1))"), seen.toString());
        assertTrue(seen.contains("DEBUG lux.resolver: resolved 2 statements, 0 diagnostics"), seen.toString());
        assertTrue(seen.contains("TRACE lux.interpreter: call <fun f> with 1 args"), seen.toString());
    }

    @Test
    void noSinkMeansNoOutputAndNoFailure() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
        Debug.get().e("lux.test", "dropped", new RuntimeException("ignored"));
    }

    @Test
    void printStreamSinkFiltersByLevel() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStreamDebugSink sink = new PrintStreamDebugSink(new PrintStream(buf, true, StandardCharsets.UTF_8), DebugLevel.INFO);
        Debug.get().setSink(sink);

        Debug.get().t("lux.test", "trace");
        Debug.get().d("lux.test", "debug");
        Debug.get().i("lux.test", "info");
        Debug.get().w("lux.test", "warn");

        String text = buf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
        assertEquals("[INFO] lux.test: info\n[WARN] lux.test: warn\n", text);
        assertEquals(DebugLevel.INFO, sink.minLevel());
    }

    @Test
    void isEnabledFollowsTheInstalledSink() {
        Debug.get().setSink(null);
        assertFalse(Debug.get().isEnabled(DebugLevel.TRACE));
        assertFalse(Debug.get().isEnabled(DebugLevel.ERROR));

        Debug.get().setSink(new PrintStreamDebugSink(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8), DebugLevel.INFO));
        assertFalse(Debug.get().isEnabled(DebugLevel.TRACE));
        assertTrue(Debug.get().isEnabled(DebugLevel.INFO));
        assertTrue(Debug.get().isEnabled(DebugLevel.WARN));
    }

    @Test
    void levelOrdering() {
        assertTrue(DebugLevel.ERROR.atLeast(DebugLevel.WARN));
        assertTrue(DebugLevel.DEBUG.atLeast(DebugLevel.DEBUG));
        assertFalse(DebugLevel.TRACE.atLeast(DebugLevel.DEBUG));
    }
}
