package com.tyron.markj.api.diagnostics;

import com.tyron.markj.api.html.TagToken;

import java.util.List;

/**
 * A checker that inspects the tag tokens of a document snapshot.
 *
 * Checkers receive the shared token list instead of re-scanning the text themselves; the text is
 * passed along for checks that look at content between tags.
 */
public interface MarkupChecker {

    /**
     * Short id reported as {@link Diagnostic#getSource()}.
     */
    String getId();

    List<Diagnostic> check(List<TagToken> tokens, String text);
}
