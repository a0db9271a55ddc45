import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux.script.LuxScript;
import com.lux.script.report.ErrorReporter;
import com.lux.script.report.JsonErrorReporter;
import com.lux.script.report.TextErrorReporter;

public class ErrorReporterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static String[] report(String source, boolean json) {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8);
        ErrorReporter reporter = json ? new JsonErrorReporter(errStream) : new TextErrorReporter(errStream);
        LuxScript engine = new LuxScript(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8), reporter);
        engine.execute(source);
        String text = err.toString(StandardCharsets.UTF_8).replace("\r\n", "\n").trim();
        return text.isEmpty() ? new String[0] : text.split("\n");
    }

    @Test
    void text_compileErrorsWithLineNumbers() {
        String[] lines = report("print 1;\nvar = 2;\n1 +;", false);
        assertEquals(2, lines.length);
        assertEquals("[line 2] Error: Expected identifier got =", lines[0]);
        assertEquals("[line 3] Error: Expected one of true, false, nil, number, string, identifier, or ( but found ;", lines[1]);
    }

    @Test
    void text_runtimeError() {
        String[] lines = report("print 1;\n\nprint 1 / 0;", false);
        assertArrayEquals(new String[] { "[line 3] Runtime error: Cannot divide by zero" }, lines);
    }

    @Test
    void text_resolverError() {
        String[] lines = report("fun f() {}\nreturn 2;", false);
        assertArrayEquals(new String[] { "[line 2] Error: Can't return from top-level code." }, lines);
    }

    @Test
    void json_oneObjectPerError() throws Exception {
        String[] lines = report("var = 1;\nprint ;", true);
        assertEquals(2, lines.length);

        JsonNode first = MAPPER.readTree(lines[0]);
        assertEquals("compile", first.get("type").asText());
        assertEquals(1, first.get("line").asInt());
        assertEquals(4, first.get("start").asInt());
        assertEquals(5, first.get("end").asInt());
        assertEquals("Expected identifier got =", first.get("message").asText());

        JsonNode second = MAPPER.readTree(lines[1]);
        assertEquals(2, second.get("line").asInt());
    }

    @Test
    void json_runtimeErrorHasKind() throws Exception {
        String[] lines = report("var f = 1;\nf();", true);
        assertEquals(1, lines.length);

        JsonNode node = MAPPER.readTree(lines[0]);
        assertEquals("runtime", node.get("type").asText());
        assertEquals("TYPE_ERROR", node.get("kind").asText());
        assertEquals(2, node.get("line").asInt());
        assertEquals("Type `number` is not callable, can only call functions", node.get("message").asText());
    }

    @Test
    void cleanRunReportsNothing() {
        assertEquals(0, report("print 1;", false).length);
        assertEquals(0, report("print 1;", true).length);
    }
}
