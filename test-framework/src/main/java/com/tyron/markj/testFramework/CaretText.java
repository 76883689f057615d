package com.tyron.markj.testFramework;

import java.util.Objects;

/**
 * Test text with a {@code <caret>} marker.
 *
 * <pre>{@code
 * CaretText t = CaretText.parse("<div><caret><p></p></div>");
 * t.text();   // "<div><p></p></div>"
 * t.offset(); // 5
 * }</pre>
 */
public record CaretText(String text, int offset) {

    public static final String CARET = "<caret>";

    public static CaretText parse(String marked) {
        Objects.requireNonNull(marked, "marked");
        int idx = marked.indexOf(CARET);
        if (idx < 0) {
            throw new IllegalArgumentException("missing " + CARET + " marker");
        }
        if (marked.indexOf(CARET, idx + 1) >= 0) {
            throw new IllegalArgumentException("more than one " + CARET + " marker");
        }
        return new CaretText(marked.substring(0, idx) + marked.substring(idx + CARET.length()), idx);
    }
}
