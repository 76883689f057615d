package com.tyron.markj.core.editor.document;

import com.tyron.markj.api.editor.DocumentEvent;
import com.tyron.markj.api.editor.DocumentListener;
import com.tyron.markj.api.editor.ObservableDocument;
import com.tyron.markj.core.text.LineIndex;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Simple in-memory {@link ObservableDocument} implementation, independent of any UI toolkit.
 *
 * The line count is maintained incrementally; the line-start table used by offset/line conversions
 * is rebuilt lazily after a change.
 *
 * Thread-safety: all text operations are synchronized on an internal lock. Listeners are notified
 * outside the lock, on the modifying thread.
 */
public final class InMemoryDocument implements ObservableDocument {

    private final Object lock = new Object();
    private final StringBuilder text;
    private final CopyOnWriteArrayList<DocumentListener> listeners = new CopyOnWriteArrayList<>();

    private int lineCount;
    private LineIndex lineIndex;

    private volatile long modificationStamp;

    public InMemoryDocument(String initialText) {
        this.text = new StringBuilder(initialText != null ? initialText : "");
        this.lineCount = LineIndex.countLines(this.text);
        this.modificationStamp = 0L;
    }

    @Override
    public String getText() {
        synchronized (lock) {
            return text.toString();
        }
    }

    @Override
    public int getTextLength() {
        synchronized (lock) {
            return text.length();
        }
    }

    @Override
    public void replace(int start, int end, String newText) {
        Objects.requireNonNull(newText, "text");

        DocumentEvent event;
        synchronized (lock) {
            int len = text.length();
            if (start < 0 || end < start || end > len) {
                throw new IndexOutOfBoundsException("replace range [" + start + ", " + end + ") is out of bounds for length=" + len);
            }

            int oldLineCount = lineCount;
            int removedLines = countNewlines(text, start, end);
            int addedLines = countNewlines(newText, 0, newText.length());

            text.replace(start, end, newText);
            lineCount = oldLineCount - removedLines + addedLines;
            lineIndex = null;
            modificationStamp++;
            event = new DocumentEvent(this, start, end, newText, oldLineCount, lineCount);
        }

        for (DocumentListener listener : listeners) {
            listener.documentChanged(event);
        }
    }

    @Override
    public void insertString(int offset, String insertedText) {
        replace(offset, offset, insertedText);
    }

    @Override
    public void deleteString(int start, int end) {
        replace(start, end, "");
    }

    @Override
    public String getText(int start, int length) {
        synchronized (lock) {
            int len = text.length();
            if (start < 0 || length < 0 || start + length > len) {
                throw new IndexOutOfBoundsException("getText start=" + start + " length=" + length + " is out of bounds for length=" + len);
            }
            return text.substring(start, start + length);
        }
    }

    @Override
    public int getLineCount() {
        synchronized (lock) {
            return lineCount;
        }
    }

    @Override
    public int getLineNumber(int offset) {
        synchronized (lock) {
            return lines().getLineOfOffset(offset);
        }
    }

    @Override
    public int getLineStartOffset(int line) {
        synchronized (lock) {
            return lines().getLineStart(line);
        }
    }

    @Override
    public void addDocumentListener(DocumentListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeDocumentListener(DocumentListener listener) {
        listeners.remove(listener);
    }

    @Override
    public long getModificationStamp() {
        return modificationStamp;
    }

    private LineIndex lines() {
        LineIndex index = lineIndex;
        if (index == null) {
            index = LineIndex.of(text);
            lineIndex = index;
        }
        return index;
    }

    private static int countNewlines(CharSequence s, int start, int end) {
        int n = 0;
        for (int i = start; i < end; i++) {
            if (s.charAt(i) == '\n') n++;
        }
        return n;
    }
}
