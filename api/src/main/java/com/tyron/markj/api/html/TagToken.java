package com.tyron.markj.api.html;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A lexically recognized {@code <...>} tag in a text snapshot.
 *
 * Offsets are half-open: the tag occupies {@code [startOffset, endOffset)}. Tokens are immutable
 * and are discarded wholesale when the text is re-scanned.
 */
public final class TagToken {

    private final int startOffset;
    private final int endOffset;
    private final String name;
    private final boolean closing;
    private final boolean selfClosing;
    private final String rawText;

    private volatile Map<String, String> attributes;

    public TagToken(int startOffset, int endOffset, @NotNull String name,
                    boolean closing, boolean selfClosing, @NotNull String rawText) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rawText, "rawText");
        if (startOffset < 0 || endOffset <= startOffset) {
            throw new IllegalArgumentException("invalid tag range [" + startOffset + ", " + endOffset + ")");
        }
        if (!rawText.startsWith("<") || !rawText.endsWith(">")) {
            throw new IllegalArgumentException("not a tag: " + rawText);
        }
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.name = name.toLowerCase(Locale.ROOT);
        this.closing = closing;
        this.selfClosing = selfClosing;
        this.rawText = rawText;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int getLength() {
        return endOffset - startOffset;
    }

    /**
     * @return the lower-cased tag name
     */
    public @NotNull String getName() {
        return name;
    }

    public boolean isClosing() {
        return closing;
    }

    public boolean isSelfClosing() {
        return selfClosing;
    }

    /**
     * @return true for a tag that expects a closing partner
     */
    public boolean isOpening() {
        return !closing && !selfClosing;
    }

    public @NotNull String getRawText() {
        return rawText;
    }

    /**
     * Attributes parsed best-effort from the raw text, in source order.
     *
     * Closing tags have no attributes.
     */
    public @NotNull Map<String, String> getAttributes() {
        Map<String, String> result = attributes;
        if (result == null) {
            result = closing ? Map.of() : TagAttributes.parse(rawText);
            attributes = result;
        }
        return result;
    }

    public boolean hasAttribute(@NotNull String attributeName) {
        return getAttributes().containsKey(attributeName.toLowerCase(Locale.ROOT));
    }

    /**
     * @return true if {@code offset} lies inside {@code [startOffset, endOffset)}
     */
    public boolean contains(int offset) {
        return offset >= startOffset && offset < endOffset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagToken other)) return false;
        return startOffset == other.startOffset
                && endOffset == other.endOffset
                && closing == other.closing
                && selfClosing == other.selfClosing
                && name.equals(other.name)
                && rawText.equals(other.rawText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startOffset, endOffset, name, closing, selfClosing);
    }

    @Override
    public String toString() {
        return rawText + "@[" + startOffset + ", " + endOffset + ")";
    }
}
