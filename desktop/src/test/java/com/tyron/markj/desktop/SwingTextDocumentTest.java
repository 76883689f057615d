package com.tyron.markj.desktop;

import com.tyron.markj.api.editor.DocumentEvent;
import com.tyron.markj.api.folding.FoldRegion;
import com.tyron.markj.core.editor.DocumentStructureIndex;
import com.tyron.markj.testFramework.BaseMarkupTest;
import org.junit.jupiter.api.Test;

import javax.swing.JTextArea;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SwingTextDocumentTest extends BaseMarkupTest {

    @Test
    public void linesFollowTheComponent() {
        SwingTextDocument doc = new SwingTextDocument(new JTextArea("<ul>\n    <li>x</li>\n</ul>"));

        assertEquals(3, doc.getLineCount());
        assertEquals(5, doc.getLineStartOffset(1));
        assertEquals(1, doc.getLineNumber(8));
        assertEquals(2, doc.getLineNumber(doc.getTextLength()));
        assertThrows(IndexOutOfBoundsException.class, () -> doc.getLineStartOffset(3));
        assertThrows(IndexOutOfBoundsException.class, () -> doc.getLineNumber(-1));
    }

    @Test
    public void swingEditsAreReported() {
        JTextArea area = new JTextArea("<p></p>");
        SwingTextDocument doc = new SwingTextDocument(area);
        List<DocumentEvent> events = new ArrayList<>();
        doc.addDocumentListener(events::add);

        area.insert("\n<b></b>", 7);
        doc.deleteString(0, 3);

        assertEquals(2, events.size());
        DocumentEvent insert = events.get(0);
        assertEquals(7, insert.getStartOffset());
        assertEquals("\n<b></b>", insert.getNewText());
        assertTrue(insert.isLineCountChanged());

        DocumentEvent remove = events.get(1);
        assertEquals(0, remove.getStartOffset());
        assertEquals(3, remove.getEndOffset());
        assertFalse(remove.isLineCountChanged());
        assertEquals(2, doc.getModificationStamp());
    }

    @Test
    public void disposeStopsEvents() {
        JTextArea area = new JTextArea("a");
        SwingTextDocument doc = new SwingTextDocument(area);
        List<DocumentEvent> events = new ArrayList<>();
        doc.addDocumentListener(events::add);

        doc.dispose();
        area.append("b");

        assertTrue(events.isEmpty());
        assertEquals("ab", doc.getText());
    }

    @Test
    public void drivesStructureIndex() {
        JTextArea area = new JTextArea("<div>\n</div>");
        SwingTextDocument doc = new SwingTextDocument(area);
        DocumentStructureIndex index = new DocumentStructureIndex(doc, debouncer, 4);
        assertTrue(index.getRegions().isEmpty());

        area.insert("    <p>x</p>\n", 6);
        debouncer.runPending();

        assertEquals(List.of(new FoldRegion(0, 1, 0)), index.getRegions());
        assertTrue(index.matchTag(0).isMatched());
        index.dispose();
    }
}
