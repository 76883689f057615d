package com.tyron.markj.core.html;

import com.tyron.markj.api.html.TagMatch;
import com.tyron.markj.api.html.TagToken;

import java.util.List;
import java.util.Objects;

/**
 * Finds the tag at an offset and its partner using a same-name depth counter.
 *
 * The token list must be ordered by start offset and non-overlapping, as produced by
 * {@link HtmlTagTokenizer}. The list is never modified.
 */
public final class TagPairMatcher {

    public TagMatch match(List<TagToken> tokens, int offset) {
        Objects.requireNonNull(tokens, "tokens");

        int index = indexOfTokenAt(tokens, offset);
        if (index < 0) {
            return TagMatch.noTag();
        }

        TagToken token = tokens.get(index);
        if (token.isSelfClosing()) {
            return TagMatch.selfClosing(token);
        }

        int partner = token.isClosing()
                ? findOpeningPartner(tokens, index)
                : findClosingPartner(tokens, index);
        return partner < 0 ? TagMatch.unmatched(token) : TagMatch.matched(token, tokens.get(partner));
    }

    /**
     * Resolves the token at {@code offset}.
     *
     * A token whose range {@code [start, end)} contains the offset wins. Otherwise a token ending
     * exactly at the offset is used, so a caret placed right after {@code >} still resolves to that tag.
     * The inclusive end applies only when no tag starts at the offset: in {@code <div><p>} offset 5
     * resolves to {@code <p>}.
     *
     * @return the index of the token, or -1
     */
    public static int indexOfTokenAt(List<TagToken> tokens, int offset) {
        if (tokens.isEmpty() || offset < 0) {
            return -1;
        }

        // Last token with start <= offset.
        int lo = 0;
        int hi = tokens.size() - 1;
        int candidate = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (tokens.get(mid).getStartOffset() <= offset) {
                candidate = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        if (candidate < 0) {
            return -1;
        }

        TagToken token = tokens.get(candidate);
        if (token.contains(offset) || token.getEndOffset() == offset) {
            return candidate;
        }
        return -1;
    }

    private static int findClosingPartner(List<TagToken> tokens, int openIndex) {
        String name = tokens.get(openIndex).getName();
        int depth = 0;
        for (int i = openIndex + 1; i < tokens.size(); i++) {
            TagToken t = tokens.get(i);
            if (t.isSelfClosing() || !t.getName().equals(name)) {
                continue;
            }
            if (!t.isClosing()) {
                depth++;
            } else if (depth == 0) {
                return i;
            } else {
                depth--;
            }
        }
        return -1;
    }

    private static int findOpeningPartner(List<TagToken> tokens, int closeIndex) {
        String name = tokens.get(closeIndex).getName();
        int depth = 0;
        for (int i = closeIndex - 1; i >= 0; i--) {
            TagToken t = tokens.get(i);
            if (t.isSelfClosing() || !t.getName().equals(name)) {
                continue;
            }
            if (t.isClosing()) {
                depth++;
            } else if (depth == 0) {
                return i;
            } else {
                depth--;
            }
        }
        return -1;
    }
}
