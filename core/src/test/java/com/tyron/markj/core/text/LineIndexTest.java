package com.tyron.markj.core.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LineIndexTest {

    @Test
    public void emptyTextHasOneLine() {
        LineIndex index = LineIndex.of("");

        assertEquals(1, index.getLineCount());
        assertEquals(0, index.getLineStart(0));
        assertEquals(0, index.getLineEnd(0));
        assertEquals(0, index.getLineOfOffset(0));
    }

    @Test
    public void mapsOffsetsToLines() {
        String text = "ab\ncd\n\nef";
        LineIndex index = LineIndex.of(text);

        assertEquals(4, index.getLineCount());
        assertEquals(0, index.getLineOfOffset(0));
        assertEquals(0, index.getLineOfOffset(2));
        assertEquals(1, index.getLineOfOffset(3));
        assertEquals(2, index.getLineOfOffset(6));
        assertEquals(3, index.getLineOfOffset(7));
        assertEquals(3, index.getLineOfOffset(text.length()));

        assertEquals("cd", index.getLineText(text, 1));
        assertEquals("", index.getLineText(text, 2));
        assertEquals("ef", index.getLineText(text, 3));
    }

    @Test
    public void trailingNewlineStartsAnEmptyLastLine() {
        LineIndex index = LineIndex.of("a\n");

        assertEquals(2, index.getLineCount());
        assertEquals(2, index.getLineStart(1));
        assertEquals(1, index.getLineOfOffset(2));
        assertEquals(2, LineIndex.countLines("a\n"));
    }

    @Test
    public void carriageReturnStaysInLineContent() {
        String text = "a\r\nb";
        assertEquals("a\r", LineIndex.of(text).getLineText(text, 0));
    }

    @Test
    public void rejectsOutOfRange() {
        LineIndex index = LineIndex.of("abc");

        assertThrows(IndexOutOfBoundsException.class, () -> index.getLineOfOffset(4));
        assertThrows(IndexOutOfBoundsException.class, () -> index.getLineOfOffset(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> index.getLineStart(1));
    }

    @Test
    public void indentationCountsSpacesAndTabs() {
        assertEquals(3, Indentation.measure(" \t x"));
        assertEquals(0, Indentation.measure("x "));
        assertEquals("\t ", Indentation.leadingWhitespace("\t <p>"));
        assertTrue(Indentation.isBlank(" \t"));
        assertFalse(Indentation.isBlank(" x"));
    }
}
