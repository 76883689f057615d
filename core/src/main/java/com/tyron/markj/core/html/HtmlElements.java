package com.tyron.markj.core.html;

import java.util.Locale;
import java.util.Set;

/**
 * Element tables shared by markup-aware features.
 */
public final class HtmlElements {

    /**
     * HTML elements that never have a closing tag, with or without a trailing {@code />}.
     */
    public static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input",
            "link", "meta", "param", "source", "track", "wbr");

    private HtmlElements() {
    }

    public static boolean isVoidElement(String name) {
        return name != null && VOID_ELEMENTS.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * @return 1..6 for {@code h1}..{@code h6}, otherwise 0
     */
    public static int headingLevel(String name) {
        if (name == null || name.length() != 2) return 0;
        char h = Character.toLowerCase(name.charAt(0));
        char d = name.charAt(1);
        return h == 'h' && d >= '1' && d <= '6' ? d - '0' : 0;
    }
}
