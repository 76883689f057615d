package com.tyron.markj.api.folding;

/**
 * Notification that the lines of a region changed visibility.
 *
 * @param visible true when lines {@code startLine + 1 .. endLine} were shown again
 */
public record FoldToggle(int startLine, int endLine, boolean visible) {
}
