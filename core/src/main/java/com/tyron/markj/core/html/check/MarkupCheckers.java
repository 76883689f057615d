package com.tyron.markj.core.html.check;

import com.tyron.markj.api.diagnostics.Diagnostic;
import com.tyron.markj.api.diagnostics.MarkupChecker;
import com.tyron.markj.api.html.TagToken;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of the built-in checkers and a helper to run several of them over one token list.
 */
public final class MarkupCheckers {

    private static final Logger LOG = Logger.getLogger(MarkupCheckers.class.getName());

    private MarkupCheckers() {
    }

    public static List<MarkupChecker> defaults() {
        return List.of(new TagBalanceChecker(), new AccessibilityChecker());
    }

    /**
     * Runs every checker and returns all diagnostics ordered by start offset.
     */
    public static List<Diagnostic> runAll(List<MarkupChecker> checkers, List<TagToken> tokens, String text) {
        List<Diagnostic> all = new ArrayList<>();
        for (MarkupChecker checker : checkers) {
            List<Diagnostic> result = checker.check(tokens, text);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(checker.getId() + ": " + result.size() + " diagnostic(s)");
            }
            all.addAll(result);
        }
        all.sort(Comparator.comparingInt(Diagnostic::getStartOffset));
        return all;
    }
}
