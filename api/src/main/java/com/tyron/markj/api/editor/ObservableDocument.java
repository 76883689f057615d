package com.tyron.markj.api.editor;

/**
 * Extension of {@link Document} for buffers that publish change events.
 *
 * Structure indexing (tag matching, folding) only works on observable documents, since it
 * rebuilds itself from change notifications.
 */
public interface ObservableDocument extends Document {

    void addDocumentListener(DocumentListener listener);

    void removeDocumentListener(DocumentListener listener);

    /**
     * Monotonically increasing stamp; increments on every change.
     */
    long getModificationStamp();
}
