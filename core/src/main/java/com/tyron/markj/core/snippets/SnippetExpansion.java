package com.tyron.markj.core.snippets;

/**
 * Text to insert for a snippet and where the caret goes, relative to the insertion offset.
 */
public record SnippetExpansion(String text, int caretOffset) {
}
