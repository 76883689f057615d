package com.tyron.markj.core.snippets;

import java.util.Objects;

/**
 * A reusable text template.
 *
 * @param name        unique display name
 * @param trigger     short abbreviation typed by the user, e.g. {@code "ul"}
 * @param description one-line description, may be empty
 * @param body        template text; {@code $0} marks the caret position after insertion
 */
public record Snippet(String name, String trigger, String description, String body) {

    public static final String CARET_MARKER = "$0";

    public Snippet {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        if (name.isBlank()) {
            throw new IllegalArgumentException("snippet name is blank");
        }
        trigger = trigger != null ? trigger : "";
        description = description != null ? description : "";
    }

    /**
     * Expands the body for insertion on a line indented with {@code indent}: every line after the
     * first gets the indent prepended, and the caret marker is removed.
     */
    public SnippetExpansion expand(String indent) {
        String prefix = indent != null ? indent : "";
        String[] lines = body.split("\n", -1);
        StringBuilder out = new StringBuilder(body.length() + lines.length * prefix.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
                if (!lines[i].isEmpty()) {
                    out.append(prefix);
                }
            }
            out.append(lines[i]);
        }

        int caret = out.indexOf(CARET_MARKER);
        if (caret >= 0) {
            out.delete(caret, caret + CARET_MARKER.length());
        } else {
            caret = out.length();
        }
        return new SnippetExpansion(out.toString(), caret);
    }
}
