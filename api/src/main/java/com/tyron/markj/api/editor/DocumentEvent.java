package com.tyron.markj.api.editor;

/**
 * Represents a single text change in a {@link Document}.
 *
 * Ranges are in document offsets and follow the same convention as {@link Document#replace(int, int, String)}:
 * the replaced range is {@code [startOffset, endOffset)} in the text <em>before</em> the change.
 * The event also carries the line count before and after the change, which is what structure
 * consumers (folding) use to decide whether line-keyed state must be revalidated.
 */
public final class DocumentEvent {

    private final Document document;
    private final int startOffset;
    private final int endOffset;
    private final String newText;
    private final int oldLineCount;
    private final int newLineCount;

    public DocumentEvent(Document document, int startOffset, int endOffset, String newText,
                         int oldLineCount, int newLineCount) {
        this.document = document;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.newText = newText != null ? newText : "";
        this.oldLineCount = oldLineCount;
        this.newLineCount = newLineCount;
    }

    public Document getDocument() {
        return document;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public String getNewText() {
        return newText;
    }

    public int getOldLength() {
        return Math.max(0, endOffset - startOffset);
    }

    public int getOldLineCount() {
        return oldLineCount;
    }

    public int getNewLineCount() {
        return newLineCount;
    }

    public boolean isLineCountChanged() {
        return oldLineCount != newLineCount;
    }

    @Override
    public String toString() {
        return "DocumentEvent[" + startOffset + ", " + endOffset + ") +" + newText.length()
                + " lines " + oldLineCount + "->" + newLineCount;
    }
}
