package com.tyron.markj.core.html;

import com.tyron.markj.api.html.TagToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scans text for HTML tags in a single left-to-right pass.
 *
 * A tag is {@code <}, an optional {@code /}, a name ({@code [A-Za-z][A-Za-z0-9:_.-]*}), optional
 * attributes, an optional {@code /} and {@code >}. Anything else starting with {@code <} is skipped.
 * Quoted attribute values may contain {@code >}; a quote that is not closed before the next
 * {@code <} is treated as an ordinary character. Comments ({@code <!-- ... -->}) are skipped whole.
 *
 * The tokenizer is stateless and never throws for any input.
 */
public final class HtmlTagTokenizer {

    private static final String COMMENT_START = "<!--";
    private static final String COMMENT_END = "-->";

    public List<TagToken> tokenize(CharSequence text) {
        if (text == null || text.length() == 0) {
            return List.of();
        }

        List<TagToken> tokens = new ArrayList<>();
        int len = text.length();
        int i = 0;
        while (i < len) {
            if (text.charAt(i) != '<') {
                i++;
                continue;
            }

            if (startsWith(text, i, COMMENT_START)) {
                int close = indexOf(text, COMMENT_END, i + COMMENT_START.length());
                i = close < 0 ? len : close + COMMENT_END.length();
                continue;
            }

            int end = scanTag(text, i);
            if (end < 0) {
                // Not a tag; resume right after this '<'.
                i++;
                continue;
            }

            tokens.add(createToken(text, i, end));
            i = end;
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * @return the exclusive end offset of the tag starting at {@code start}, or -1 if there is none
     */
    private static int scanTag(CharSequence text, int start) {
        int len = text.length();
        int i = start + 1;
        if (i < len && text.charAt(i) == '/') {
            i++;
        }
        if (i >= len || !isNameStart(text.charAt(i))) {
            return -1;
        }
        while (i < len && isNamePart(text.charAt(i))) {
            i++;
        }
        if (i >= len) {
            return -1;
        }
        char afterName = text.charAt(i);
        if (afterName != '>' && afterName != '/' && !Character.isWhitespace(afterName)) {
            return -1;
        }

        while (i < len) {
            char c = text.charAt(i);
            if (c == '>') {
                return i + 1;
            }
            if (c == '<') {
                return -1;
            }
            if (c == '"' || c == '\'') {
                int close = findQuoteEnd(text, i + 1, c);
                i = close < 0 ? i + 1 : close + 1;
                continue;
            }
            i++;
        }
        return -1;
    }

    private static int findQuoteEnd(CharSequence text, int from, char quote) {
        for (int i = from, len = text.length(); i < len; i++) {
            char c = text.charAt(i);
            if (c == quote) return i;
            if (c == '<') return -1;
        }
        return -1;
    }

    private static TagToken createToken(CharSequence text, int start, int end) {
        String raw = text.subSequence(start, end).toString();
        boolean closing = raw.startsWith("</");

        int nameStart = closing ? 2 : 1;
        int nameEnd = nameStart;
        while (nameEnd < raw.length() && isNamePart(raw.charAt(nameEnd))) {
            nameEnd++;
        }
        String name = raw.substring(nameStart, nameEnd);

        boolean selfClosing = false;
        if (!closing) {
            int j = raw.length() - 2;
            while (j > nameEnd - 1 && Character.isWhitespace(raw.charAt(j))) {
                j--;
            }
            selfClosing = j >= nameEnd && raw.charAt(j) == '/';
        }

        return new TagToken(start, end, name, closing, selfClosing, raw);
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9') || c == ':' || c == '_' || c == '.' || c == '-';
    }

    private static boolean startsWith(CharSequence text, int offset, String prefix) {
        if (offset + prefix.length() > text.length()) return false;
        for (int k = 0; k < prefix.length(); k++) {
            if (text.charAt(offset + k) != prefix.charAt(k)) return false;
        }
        return true;
    }

    private static int indexOf(CharSequence text, String needle, int from) {
        int last = text.length() - needle.length();
        for (int i = from; i <= last; i++) {
            if (startsWith(text, i, needle)) return i;
        }
        return -1;
    }
}
