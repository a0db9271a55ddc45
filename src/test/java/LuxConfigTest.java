import static org.junit.jupiter.api.Assertions.*;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.lux.debug.DebugLevel;
import com.lux.script.config.LuxConfig;

public class LuxConfigTest {

    @TempDir
    Path tmp;

    private Path write(String name, String json) throws Exception {
        Path p = tmp.resolve(name);
        Files.write(p, json.getBytes(StandardCharsets.UTF_8));
        return p;
    }

    @Test
    void defaultsFromClasspath() {
        LuxConfig c = LuxConfig.defaults();
        assertEquals("> ", c.getPrompt());
        assertTrue(c.isEchoValues());
        assertEquals("text", c.getErrorFormat());
        assertFalse(c.isJsonErrors());
        assertEquals("OFF", c.getLogLevel());
        assertNull(c.debugLevel());
    }

    @Test
    void userFileOverlaysDefaults_unknownKeysIgnored() throws Exception {
        Path p = write("lux.json", "{ \"prompt\": \"lux> \", \"logLevel\": \"debug\", \"colour\": \"blue\" }");
        LuxConfig c = LuxConfig.load(p);

        assertEquals("lux> ", c.getPrompt());
        assertEquals("DEBUG", c.getLogLevel());
        assertEquals(DebugLevel.DEBUG, c.debugLevel());
        // untouched keys keep their defaults
        assertTrue(c.isEchoValues());
        assertEquals("text", c.getErrorFormat());
    }

    @Test
    void jsonErrorFormat() throws Exception {
        LuxConfig c = LuxConfig.load(write("lux.json", "{ \"errorFormat\": \"JSON\", \"echoValues\": false }"));
        assertTrue(c.isJsonErrors());
        assertEquals("json", c.getErrorFormat());
        assertFalse(c.isEchoValues());
    }

    @Test
    void badValuesAreRejected() throws Exception {
        Path p = write("bad.json", "{ \"errorFormat\": \"xml\" }");
        assertThrows(UncheckedIOException.class, () -> LuxConfig.load(p));

        LuxConfig c = LuxConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> c.setErrorFormat("xml"));
        assertThrows(IllegalArgumentException.class, () -> c.setLogLevel("LOUD"));
    }

    @Test
    void unreadableOrMalformedFile() throws Exception {
        assertThrows(UncheckedIOException.class, () -> LuxConfig.load(tmp.resolve("missing.json")));

        Path p = write("broken.json", "{ \"prompt\": ");
        assertThrows(UncheckedIOException.class, () -> LuxConfig.load(p));
    }
}
