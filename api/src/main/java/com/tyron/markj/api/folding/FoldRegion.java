package com.tyron.markj.api.folding;

/**
 * A foldable line range. Collapsing it hides lines {@code startLine + 1 .. endLine}; the opener
 * line itself stays visible.
 *
 * @param startLine the opener line (0-based), also the region's identity
 * @param endLine   the last line nested under the opener (inclusive)
 * @param indent    indentation of the opener, in whitespace units
 */
public record FoldRegion(int startLine, int endLine, int indent) {

    public FoldRegion {
        if (startLine < 0 || endLine < startLine || indent < 0) {
            throw new IllegalArgumentException(
                    "invalid fold region start=" + startLine + " end=" + endLine + " indent=" + indent);
        }
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    /**
     * @return true if collapsing this region hides {@code line}
     */
    public boolean hides(int line) {
        return line > startLine && line <= endLine;
    }

    public int hiddenLineCount() {
        return endLine - startLine;
    }
}
