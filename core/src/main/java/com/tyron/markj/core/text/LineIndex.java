package com.tyron.markj.core.text;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable table of line start offsets for a text snapshot.
 *
 * Lines are separated by {@code '\n'}; a trailing {@code '\r'} is kept as part of the line content.
 * Text with N newlines has N + 1 lines, so the empty string has one (empty) line.
 */
public final class LineIndex {

    private final int textLength;
    private final int[] lineStarts;

    private LineIndex(int textLength, int[] lineStarts) {
        this.textLength = textLength;
        this.lineStarts = lineStarts;
    }

    public static LineIndex of(CharSequence text) {
        Objects.requireNonNull(text, "text");
        int len = text.length();
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < len; i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineIndex(len, Arrays.copyOf(starts, count));
    }

    public static int countLines(CharSequence text) {
        int count = 1;
        for (int i = 0, len = text.length(); i < len; i++) {
            if (text.charAt(i) == '\n') count++;
        }
        return count;
    }

    public int getLineCount() {
        return lineStarts.length;
    }

    public int getTextLength() {
        return textLength;
    }

    public int getLineStart(int line) {
        checkLine(line);
        return lineStarts[line];
    }

    /**
     * @return offset of the line terminator, or the text length for the last line
     */
    public int getLineEnd(int line) {
        checkLine(line);
        return line + 1 < lineStarts.length ? lineStarts[line + 1] - 1 : textLength;
    }

    public int getLineOfOffset(int offset) {
        if (offset < 0 || offset > textLength) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + textLength);
        }
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx : -idx - 2;
    }

    public String getLineText(CharSequence text, int line) {
        return text.subSequence(getLineStart(line), getLineEnd(line)).toString();
    }

    private void checkLine(int line) {
        if (line < 0 || line >= lineStarts.length) {
            throw new IndexOutOfBoundsException("line " + line + " is out of bounds for lineCount=" + lineStarts.length);
        }
    }
}
