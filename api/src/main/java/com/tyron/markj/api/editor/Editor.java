package com.tyron.markj.api.editor;

/**
 * Abstract view of one editor tab: a document plus its caret.
 */
public interface Editor {
    Document getDocument();

    Carets getCaretModel();

    /**
     * Scroll the view so the caret is visible.
     */
    void scrollToCaret();

    interface Carets {
        int getOffset();

        void moveToOffset(int offset);
    }
}
