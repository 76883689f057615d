package com.tyron.markj.core.html;

import com.tyron.markj.api.html.TagToken;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HtmlTagTokenizerTest {

    private final HtmlTagTokenizer tokenizer = new HtmlTagTokenizer();

    @Test
    public void tokenizesNestedTagsWithOffsets() {
        List<TagToken> tokens = tokenizer.tokenize("<div><p>Hello</p></div>");

        assertEquals(4, tokens.size());
        assertToken(tokens.get(0), 0, 5, "div", false, false);
        assertToken(tokens.get(1), 5, 8, "p", false, false);
        assertToken(tokens.get(2), 13, 17, "p", true, false);
        assertToken(tokens.get(3), 17, 23, "div", true, false);
    }

    @Test
    public void recognizesSelfClosingTagsWithOptionalWhitespace() {
        List<TagToken> tokens = tokenizer.tokenize("<br/><img src=\"a.png\" / ><hr>");

        assertEquals(3, tokens.size());
        assertTrue(tokens.get(0).isSelfClosing());
        assertTrue(tokens.get(1).isSelfClosing());
        assertEquals("img", tokens.get(1).getName());
        // A void element without the slash is an ordinary opening tag.
        assertFalse(tokens.get(2).isSelfClosing());
        assertTrue(tokens.get(2).isOpening());
    }

    @Test
    public void quotedAttributeValueMayContainGreaterThan() {
        String text = "<a href=\"x>y\">link</a>";
        List<TagToken> tokens = tokenizer.tokenize(text);

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), 0, 14, "a", false, false);
        assertEquals("x>y", tokens.get(0).getAttributes().get("href"));
        assertToken(tokens.get(1), 18, 22, "a", true, false);
    }

    @Test
    public void unterminatedQuoteDoesNotSwallowTheDocument() {
        List<TagToken> tokens = tokenizer.tokenize("<p title=\"oops>text</p>");

        assertEquals(2, tokens.size());
        assertEquals("<p title=\"oops>", tokens.get(0).getRawText());
        assertToken(tokens.get(1), 19, 23, "p", true, false);
    }

    @Test
    public void skipsCommentsAndNonTags() {
        List<TagToken> tokens = tokenizer.tokenize("<!-- <p> --> a < b, 1<2, < p> <b></b><!-- unterminated <i>");

        assertEquals(2, tokens.size());
        assertEquals("b", tokens.get(0).getName());
        assertTrue(tokens.get(1).isClosing());
    }

    @Test
    public void skipsDoctype() {
        List<TagToken> tokens = tokenizer.tokenize("<!DOCTYPE html>\n<html></html>");
        assertEquals(2, tokens.size());
        assertEquals("html", tokens.get(0).getName());
    }

    @Test
    public void namesAreLowercased() {
        List<TagToken> tokens = tokenizer.tokenize("<DIV Class=x></Div >");

        assertEquals("div", tokens.get(0).getName());
        assertEquals("div", tokens.get(1).getName());
        assertTrue(tokens.get(1).isClosing());
    }

    @Test
    public void tagAtEndOfTextWithoutGreaterThanIsIgnored() {
        assertEquals(1, tokenizer.tokenize("<p>text</p").size());
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
    }

    @Test
    public void tokensAreOrderedAndDisjoint() {
        String text = "<html lang=en><body><ul><li>a<li>b</ul><br/><p title='a>b'>x</p></body></html>";
        List<TagToken> tokens = tokenizer.tokenize(text);

        assertFalse(tokens.isEmpty());
        for (int i = 1; i < tokens.size(); i++) {
            assertTrue(tokens.get(i - 1).getEndOffset() <= tokens.get(i).getStartOffset(),
                    "overlap at " + tokens.get(i));
        }
        for (TagToken t : tokens) {
            assertEquals(t.getRawText(), text.substring(t.getStartOffset(), t.getEndOffset()));
        }
    }

    @Test
    public void pathologicalInputFinishesInLinearTime() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 50_000; i++) {
            sb.append("<a \"x ").append(i % 7 == 0 ? '<' : ' ');
        }
        String text = sb.toString();

        List<TagToken> tokens = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> tokenizer.tokenize(text));
        assertNotNull(tokens);
    }

    private static void assertToken(TagToken t, int start, int end, String name, boolean closing, boolean selfClosing) {
        assertEquals(start, t.getStartOffset(), "start of " + t);
        assertEquals(end, t.getEndOffset(), "end of " + t);
        assertEquals(name, t.getName());
        assertEquals(closing, t.isClosing(), "closing " + t);
        assertEquals(selfClosing, t.isSelfClosing(), "selfClosing " + t);
    }
}
