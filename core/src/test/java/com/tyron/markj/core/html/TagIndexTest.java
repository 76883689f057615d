package com.tyron.markj.core.html;

import com.tyron.markj.api.html.TagToken;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TagIndexTest {

    @Test
    public void emptyIndexHasNoStamp() {
        TagIndex empty = TagIndex.empty();

        assertTrue(empty.isEmpty());
        assertEquals(-1L, empty.getModificationStamp());
        assertTrue(empty.tokenAt(0).isEmpty());
    }

    @Test
    public void buildsFromSnapshot() {
        String text = "<ul><li>a</li><LI>b</li></ul>";
        TagIndex index = TagIndex.build(new HtmlTagTokenizer(), text, 7L);

        assertEquals(7L, index.getModificationStamp());
        assertEquals(text.length(), index.getTextLength());
        assertEquals(6, index.getTokens().size());

        List<TagToken> items = index.tokensNamed("li");
        assertEquals(4, items.size());
        assertEquals("ul", index.tokenAt(1).orElseThrow().getName());
        assertTrue(index.match(5).isMatched());
    }

    @Test
    public void tokenListIsImmutable() {
        TagIndex index = TagIndex.build(new HtmlTagTokenizer(), "<p></p>", 0L);
        assertThrows(UnsupportedOperationException.class, () -> index.getTokens().clear());
    }
}
