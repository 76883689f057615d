package com.tyron.markj.desktop;

import com.tyron.markj.api.editor.DocumentEvent;
import com.tyron.markj.api.editor.DocumentListener;
import com.tyron.markj.api.editor.ObservableDocument;

import javax.swing.text.BadLocationException;
import javax.swing.text.Element;
import javax.swing.text.JTextComponent;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ObservableDocument} view of a Swing text component.
 *
 * Swing change notifications are translated into {@link DocumentEvent}s carrying the line count
 * before and after the change. Lines are the root element's children, which Swing keeps split on
 * {@code '\n'}.
 */
final class SwingTextDocument implements ObservableDocument {

    private static final Logger LOG = Logger.getLogger(SwingTextDocument.class.getName());

    private final JTextComponent component;
    private final List<DocumentListener> listeners = new CopyOnWriteArrayList<>();
    private final javax.swing.event.DocumentListener swingListener = new SwingListener();

    private int lineCount;
    private long modificationStamp;

    /**
     * The component's document must not be replaced afterwards.
     */
    SwingTextDocument(JTextComponent component) {
        this.component = Objects.requireNonNull(component, "component");
        this.lineCount = root().getElementCount();
        component.getDocument().addDocumentListener(swingListener);
    }

    void dispose() {
        component.getDocument().removeDocumentListener(swingListener);
        listeners.clear();
    }

    @Override
    public String getText() {
        return component.getText();
    }

    @Override
    public int getTextLength() {
        return component.getDocument().getLength();
    }

    @Override
    public void replace(int start, int end, String text) {
        Objects.requireNonNull(text, "text");
        try {
            var doc = component.getDocument();
            doc.remove(start, end - start);
            doc.insertString(start, text, null);
        } catch (BadLocationException e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Override
    public void insertString(int offset, String text) {
        Objects.requireNonNull(text, "text");
        try {
            component.getDocument().insertString(offset, text, null);
        } catch (BadLocationException e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Override
    public void deleteString(int start, int end) {
        try {
            component.getDocument().remove(start, end - start);
        } catch (BadLocationException e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Override
    public String getText(int start, int length) {
        try {
            return component.getDocument().getText(start, length);
        } catch (BadLocationException e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Override
    public int getLineCount() {
        return root().getElementCount();
    }

    @Override
    public int getLineNumber(int offset) {
        if (offset < 0 || offset > getTextLength()) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside [0, " + getTextLength() + "]");
        }
        return root().getElementIndex(offset);
    }

    @Override
    public int getLineStartOffset(int line) {
        Element root = root();
        if (line < 0 || line >= root.getElementCount()) {
            throw new IndexOutOfBoundsException("line " + line + " outside [0, " + root.getElementCount() + ")");
        }
        return root.getElement(line).getStartOffset();
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

    private Element root() {
        return component.getDocument().getDefaultRootElement();
    }

    private void fire(int start, int end, String newText) {
        modificationStamp++;
        int oldLines = lineCount;
        lineCount = root().getElementCount();

        DocumentEvent event = new DocumentEvent(this, start, end, newText, oldLines, lineCount);
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest(event.toString());
        }
        for (DocumentListener l : listeners) {
            l.documentChanged(event);
        }
    }

    private final class SwingListener implements javax.swing.event.DocumentListener {

        @Override
        public void insertUpdate(javax.swing.event.DocumentEvent e) {
            String inserted;
            try {
                inserted = e.getDocument().getText(e.getOffset(), e.getLength());
            } catch (BadLocationException ex) {
                throw new IllegalStateException("inserted range not in document", ex);
            }
            fire(e.getOffset(), e.getOffset(), inserted);
        }

        @Override
        public void removeUpdate(javax.swing.event.DocumentEvent e) {
            fire(e.getOffset(), e.getOffset() + e.getLength(), "");
        }

        @Override
        public void changedUpdate(javax.swing.event.DocumentEvent e) {
            // Attribute changes only; the text is unchanged.
        }
    }
}
