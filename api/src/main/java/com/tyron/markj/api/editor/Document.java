package com.tyron.markj.api.editor;

/**
 * Abstract, line-aware view of the text content of an open file.
 *
 * Offsets are 0-based character offsets. Lines are 0-based and separated by {@code '\n'};
 * a document always has at least one line.
 */
public interface Document {
    String getText();
    int getTextLength();

    /**
     * Replaces text in the range [start, end).
     */
    void replace(int start, int end, String text);

    void insertString(int offset, String text);

    void deleteString(int start, int end);

    /**
     * @return The text in the given range.
     */
    String getText(int start, int length);

    int getLineCount();

    /**
     * @return the line containing {@code offset}; the end-of-text offset belongs to the last line.
     */
    int getLineNumber(int offset);

    int getLineStartOffset(int line);
}
