package com.tyron.markj.api.editor;

/**
 * Listener for {@link Document} changes.
 */
public interface DocumentListener {

    /**
     * Fired after the document has been modified, on the thread that modified it.
     */
    void documentChanged(DocumentEvent event);
}
