package com.tyron.markj.core.html.check;

import com.tyron.markj.api.diagnostics.Diagnostic;
import com.tyron.markj.api.diagnostics.DiagnosticSeverity;
import com.tyron.markj.api.diagnostics.MarkupChecker;
import com.tyron.markj.api.html.TagToken;
import com.tyron.markj.core.html.HtmlElements;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports opening tags that never close and closing tags that close nothing.
 *
 * Pairing follows the same per-name nesting as the tag matcher, so a tag flagged here is exactly
 * a tag the matcher reports as unmatched. Void elements ({@code <br>}, {@code <img>}, ...) are skipped.
 */
public final class TagBalanceChecker implements MarkupChecker {

    public static final String ID = "balance";
    public static final String UNMATCHED_OPEN = "unmatched-open";
    public static final String STRAY_CLOSE = "stray-close";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public List<Diagnostic> check(List<TagToken> tokens, String text) {
        Map<String, Deque<TagToken>> open = new HashMap<>();
        List<Diagnostic> out = new ArrayList<>();

        for (TagToken token : tokens) {
            if (token.isSelfClosing() || HtmlElements.isVoidElement(token.getName())) {
                continue;
            }
            if (token.isOpening()) {
                open.computeIfAbsent(token.getName(), k -> new ArrayDeque<>()).push(token);
                continue;
            }
            Deque<TagToken> stack = open.get(token.getName());
            if (stack == null || stack.isEmpty()) {
                out.add(diagnostic(token, STRAY_CLOSE, "Closing tag </" + token.getName() + "> has no opening tag"));
            } else {
                stack.pop();
            }
        }

        for (Deque<TagToken> stack : open.values()) {
            for (TagToken token : stack) {
                out.add(diagnostic(token, UNMATCHED_OPEN, "Tag <" + token.getName() + "> is never closed"));
            }
        }

        out.sort(Comparator.comparingInt(Diagnostic::getStartOffset));
        return out;
    }

    private static Diagnostic diagnostic(TagToken token, String code, String message) {
        return new Diagnostic(DiagnosticSeverity.ERROR, token.getStartOffset(), token.getEndOffset(), message, code, ID);
    }
}
