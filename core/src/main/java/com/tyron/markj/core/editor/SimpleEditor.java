package com.tyron.markj.core.editor;

import com.tyron.markj.api.editor.Document;
import com.tyron.markj.api.editor.Editor;

import java.util.Objects;

/**
 * Minimal {@link Editor} implementation for headless use.
 *
 * This does not render anything; it only provides caret state and the document reference.
 * The caret is validated against the current document length.
 */
public final class SimpleEditor implements Editor {

    private final Document document;
    private final SimpleCarets carets = new SimpleCarets();

    public SimpleEditor(Document document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    @Override
    public Document getDocument() {
        return document;
    }

    @Override
    public Carets getCaretModel() {
        return carets;
    }

    @Override
    public void scrollToCaret() {
        // No-op (UI specific).
    }

    private final class SimpleCarets implements Carets {
        private volatile int offset;

        @Override
        public int getOffset() {
            return Math.min(offset, document.getTextLength());
        }

        @Override
        public void moveToOffset(int offset) {
            int length = document.getTextLength();
            if (offset < 0 || offset > length) {
                throw new IllegalArgumentException("offset " + offset + " outside document of length " + length);
            }
            this.offset = offset;
        }
    }
}
