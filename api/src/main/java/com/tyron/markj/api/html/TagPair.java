package com.tyron.markj.api.html;

import java.util.Objects;

/**
 * An opening tag together with its closing partner.
 */
public record TagPair(TagToken opening, TagToken closing) {

    public TagPair {
        Objects.requireNonNull(opening, "opening");
        Objects.requireNonNull(closing, "closing");
        if (!opening.isOpening() || !closing.isClosing()) {
            throw new IllegalArgumentException("expected opening/closing tags: " + opening + ", " + closing);
        }
        if (!opening.getName().equalsIgnoreCase(closing.getName())) {
            throw new IllegalArgumentException("tag names differ: " + opening.getName() + " vs " + closing.getName());
        }
        if (opening.getEndOffset() > closing.getStartOffset()) {
            throw new IllegalArgumentException("closing tag precedes opening tag: " + opening + ", " + closing);
        }
    }

    public String name() {
        return opening.getName();
    }
}
