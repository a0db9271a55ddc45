package com.lux.script.parser;

import java.util.Arrays;

/**
 * Maps UTF-8 byte offsets to 1-indexed line numbers.
 *
 * Built once per source string; each lookup is a binary search over the
 * offsets at which lines start.
 */
public final class LineOffsets {
    private final int[] lineStarts;
    private final int length;

    public LineOffsets(String source) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        int bytePos = 0;
        for (int i = 0; i < source.length(); ) {
            int cp = source.codePointAt(i);
            i += Character.charCount(cp);
            // same byte accounting as the lexer, so spans and lines agree
            bytePos += Lexer.utf8Length(cp);
            if (cp == '\n') {
                if (count == starts.length) starts = Arrays.copyOf(starts, count * 2);
                starts[count++] = bytePos;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
        this.length = bytePos;
    }

    public int line(int offset) {
        if (offset < 0 || offset > length) {
            throw new IllegalArgumentException("Offset " + offset + " outside source of " + length + " bytes");
        }
        int idx = Arrays.binarySearch(lineStarts, offset);
        return (idx >= 0) ? idx + 1 : -idx - 1;
    }

    public int line(Span span) {
        return line(span.start);
    }

    public int lineCount() {
        return lineStarts.length;
    }
}
