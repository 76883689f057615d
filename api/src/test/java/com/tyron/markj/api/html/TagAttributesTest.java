package com.tyron.markj.api.html;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TagAttributesTest {

    @Test
    public void parsesQuotedUnquotedAndBareAttributes() {
        Map<String, String> attrs = TagAttributes.parse("<input type=\"text\" name='q' size=10 disabled>");

        assertEquals(List.of("type", "name", "size", "disabled"), List.copyOf(attrs.keySet()));
        assertEquals("text", attrs.get("type"));
        assertEquals("q", attrs.get("name"));
        assertEquals("10", attrs.get("size"));
        assertEquals("", attrs.get("disabled"));
    }

    @Test
    public void lowercasesNamesButKeepsValues() {
        Map<String, String> attrs = TagAttributes.parse("<IMG ALT=\"Logo\" Src=a.PNG>");

        assertEquals("Logo", attrs.get("alt"));
        assertEquals("a.PNG", attrs.get("src"));
    }

    @Test
    public void selfClosingSlashIsNotPartOfAValue() {
        Map<String, String> attrs = TagAttributes.parse("<img src=a.png/>");
        assertEquals("a.png", attrs.get("src"));

        attrs = TagAttributes.parse("<br />");
        assertTrue(attrs.isEmpty());
    }

    @Test
    public void quotedValueMayContainGreaterThan() {
        assertEquals("x>y", TagAttributes.parse("<a href=\"x>y\">").get("href"));
    }

    @Test
    public void firstDuplicateWins() {
        assertEquals("1", TagAttributes.parse("<p id=1 id=2>").get("id"));
    }

    @Test
    public void closingTagsAndGarbageHaveNoAttributes() {
        assertTrue(TagAttributes.parse("</div>").isEmpty());
        assertTrue(TagAttributes.parse("<").isEmpty());
        assertTrue(TagAttributes.parse(null).isEmpty());
    }

    @Test
    public void unterminatedQuoteRunsToEndOfTag() {
        assertEquals("oops", TagAttributes.parse("<p title=\"oops>").get("title"));
    }
}
