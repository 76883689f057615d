package com.tyron.markj.api.html;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Best-effort attribute parser for the raw text of a single tag.
 *
 * Tolerates unquoted values, missing values (mapped to {@code ""}) and unterminated quotes
 * (the value runs to the end of the tag). The first occurrence of a duplicated attribute wins.
 */
public final class TagAttributes {

    private TagAttributes() {
    }

    public static Map<String, String> parse(String rawText) {
        if (rawText == null || rawText.length() < 2) {
            return Map.of();
        }

        int end = rawText.endsWith(">") ? rawText.length() - 1 : rawText.length();
        int i = rawText.startsWith("<") ? 1 : 0;
        if (i < end && rawText.charAt(i) == '/') {
            return Map.of();
        }

        // Skip the tag name.
        while (i < end && !Character.isWhitespace(rawText.charAt(i)) && rawText.charAt(i) != '/') {
            i++;
        }

        Map<String, String> result = new LinkedHashMap<>();
        while (i < end) {
            char c = rawText.charAt(i);
            if (Character.isWhitespace(c) || c == '/') {
                i++;
                continue;
            }

            int nameStart = i;
            while (i < end) {
                char n = rawText.charAt(i);
                if (Character.isWhitespace(n) || n == '=' || n == '/' && i + 1 == end) break;
                i++;
            }
            String name = rawText.substring(nameStart, i).toLowerCase(Locale.ROOT);

            while (i < end && Character.isWhitespace(rawText.charAt(i))) i++;

            String value = "";
            if (i < end && rawText.charAt(i) == '=') {
                i++;
                while (i < end && Character.isWhitespace(rawText.charAt(i))) i++;
                if (i < end && (rawText.charAt(i) == '"' || rawText.charAt(i) == '\'')) {
                    char quote = rawText.charAt(i);
                    int close = rawText.indexOf(quote, i + 1);
                    if (close < 0 || close > end) {
                        close = end;
                    }
                    value = rawText.substring(i + 1, close);
                    i = Math.min(end, close + 1);
                } else {
                    int valueStart = i;
                    while (i < end && !Character.isWhitespace(rawText.charAt(i))) {
                        if (rawText.charAt(i) == '/' && i + 1 == end) break;
                        i++;
                    }
                    value = rawText.substring(valueStart, i);
                }
            }

            if (!name.isEmpty()) {
                result.putIfAbsent(name, value);
            }
        }

        return result.isEmpty() ? Map.of() : Collections.unmodifiableMap(result);
    }
}
