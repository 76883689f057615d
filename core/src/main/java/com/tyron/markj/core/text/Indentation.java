package com.tyron.markj.core.text;

/**
 * Indentation helpers shared by fold detection and snippet expansion.
 *
 * Spaces and tabs both count as one unit. Mixed tab/space files therefore compare by character
 * count, not by visual column.
 */
public final class Indentation {

    private Indentation() {
    }

    public static int measure(CharSequence line) {
        int i = 0;
        int len = line.length();
        while (i < len) {
            char c = line.charAt(i);
            if (c != ' ' && c != '\t') break;
            i++;
        }
        return i;
    }

    public static boolean isBlank(CharSequence line) {
        for (int i = 0, len = line.length(); i < len; i++) {
            if (!Character.isWhitespace(line.charAt(i))) return false;
        }
        return true;
    }

    /**
     * @return the leading whitespace of {@code line}, verbatim
     */
    public static String leadingWhitespace(CharSequence line) {
        return line.subSequence(0, measure(line)).toString();
    }
}
