package com.tyron.markj.core.snippets;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SnippetTest {

    @Test
    public void expandIndentsContinuationLines() {
        Snippet ul = new Snippet("Unordered list", "ul", "", "<ul>\n  <li>$0</li>\n</ul>");

        SnippetExpansion expansion = ul.expand("    ");

        assertEquals("<ul>\n      <li></li>\n    </ul>", expansion.text());
        assertEquals(15, expansion.caretOffset());
    }

    @Test
    public void blankLinesStayEmpty() {
        Snippet s = new Snippet("Block", "b", "", "<div>\n\n</div>");

        assertEquals("<div>\n\n  </div>", s.expand("  ").text());
    }

    @Test
    public void caretDefaultsToEnd() {
        Snippet s = new Snippet("Break", "br", null, "<br>");

        SnippetExpansion expansion = s.expand(null);

        assertEquals("<br>", expansion.text());
        assertEquals(4, expansion.caretOffset());
        assertEquals("", s.description());
    }

    @Test
    public void blankNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Snippet(" ", "x", "", "body"));
        assertThrows(NullPointerException.class, () -> new Snippet("x", "x", "", null));
    }
}
