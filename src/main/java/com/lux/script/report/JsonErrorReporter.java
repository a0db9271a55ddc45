package com.lux.script.report;

import java.io.PrintStream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lux.debug.Debug;
import com.lux.script.parser.Diagnostic;
import com.lux.script.parser.LineOffsets;
import com.lux.script.parser.LuxRuntimeError;
import com.lux.script.parser.Span;

/**
 * Machine readable reporting: one JSON object per line, e.g.
 *
 * <pre>
 * {"type":"compile","line":1,"start":6,"end":7,"message":"Expected ; got EOF"}
 * {"type":"runtime","kind":"DIVIDE_BY_ZERO","line":2,"start":9,"end":10,"message":"Cannot divide by zero"}
 * </pre>
 *
 * {@code line} is 0 and the offsets are absent when the error has no span.
 */
public final class JsonErrorReporter implements ErrorReporter {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PrintStream out;

    public JsonErrorReporter(PrintStream out) {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        this.out = out;
    }

    @Override
    public void compileError(Diagnostic diagnostic, LineOffsets lines) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", "compile");
        putLocation(node, diagnostic.span, lines);
        node.put("message", diagnostic.message);
        write(node);
    }

    @Override
    public void runtimeError(LuxRuntimeError error, LineOffsets lines) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", "runtime");
        node.put("kind", error.kind().name());
        putLocation(node, error.span(), lines);
        node.put("message", error.getMessage());
        write(node);
    }

    private static void putLocation(ObjectNode node, Span span, LineOffsets lines) {
        node.put("line", TextErrorReporter.lineOf(span, lines));
        if (span != null) {
            node.put("start", span.start);
            node.put("end", span.end);
        }
    }

    private void write(ObjectNode node) {
        try {
            out.println(MAPPER.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            Debug.get().e("lux.run", "failed to encode error report", e);
            out.println(String.valueOf(node.get("message")));
        }
    }
}
