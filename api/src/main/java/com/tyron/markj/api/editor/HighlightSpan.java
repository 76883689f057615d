package com.tyron.markj.api.editor;

/**
 * A character range the UI should paint, e.g. a tag and its partner under the caret.
 */
public record HighlightSpan(int start, int length, Kind kind) {

    public HighlightSpan {
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException("invalid span start=" + start + " length=" + length);
        }
    }

    public int end() {
        return start + length;
    }

    public enum Kind {
        MATCHED_TAG, UNMATCHED_TAG, SELF_CLOSING_TAG
    }
}
