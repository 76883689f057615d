package com.tyron.markj.core.editor;

import com.tyron.markj.api.editor.DocumentListener;
import com.tyron.markj.api.editor.ObservableDocument;
import com.tyron.markj.api.folding.FoldRegion;
import com.tyron.markj.api.folding.FoldToggle;
import com.tyron.markj.core.editor.document.InMemoryDocument;
import com.tyron.markj.core.html.TagIndex;
import com.tyron.markj.testFramework.BaseMarkupTest;
import com.tyron.markj.testFramework.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentStructureIndexTest extends BaseMarkupTest {

    private static final String BLOCK = String.join("\n",
            "<div>",
            "    <p>a</p>",
            "    <p>b</p>",
            "</div>");

    @Test
    public void scansOnCreation() {
        InMemoryDocument doc = new InMemoryDocument(Fixtures.load("page.html"));
        DocumentStructureIndex index = new DocumentStructureIndex(doc, debouncer, 4);

        assertFalse(index.isStale());
        assertFalse(debouncer.isPending());
        assertEquals(List.of(
                new FoldRegion(1, 13, 0),
                new FoldRegion(2, 3, 4),
                new FoldRegion(5, 12, 4),
                new FoldRegion(9, 10, 8)), index.getRegions());
        assertEquals(index.getRegions(), index.getFoldingModel().getRegions());
        assertFalse(index.getTagIndex().isEmpty());
    }

    @Test
    public void editsAreCoalescedIntoOneRescan() {
        InMemoryDocument doc = new InMemoryDocument("<p></p>");
        DocumentStructureIndex index = new DocumentStructureIndex(doc, debouncer, 4);
        List<TagIndex> updates = new ArrayList<>();
        index.addStructureListener((tags, regions) -> updates.add(tags));

        doc.insertString(0, "<b>");
        doc.insertString(3, "x");
        doc.insertString(4, "</b>");

        assertTrue(index.isStale());
        assertEquals(2, index.getTagIndex().getTokens().size());
        assertTrue(updates.isEmpty());

        assertTrue(debouncer.runPending());
        assertFalse(debouncer.runPending());

        assertEquals(3, debouncer.getScheduleCount());
        assertEquals(1, debouncer.getRunCount());
        assertEquals(1, updates.size());
        assertFalse(index.isStale());
        assertEquals(4, index.getTagIndex().getTokens().size());
        assertTrue(index.matchTag(0).isMatched());
    }

    @Test
    public void lineCountChangeRevalidatesCollapsedRegionsImmediately() {
        InMemoryDocument doc = new InMemoryDocument(BLOCK);
        DocumentStructureIndex index = new DocumentStructureIndex(doc, debouncer, 4);
        List<FoldToggle> toggles = new ArrayList<>();
        index.getFoldingModel().addFoldingListener(toggles::add);

        assertTrue(index.getFoldingModel().fold(0));
        toggles.clear();

        doc.insertString(doc.getLineStartOffset(2), "    <p>c</p>\n");

        // The rescan is still pending, but the stale collapsed region is already gone.
        assertTrue(debouncer.isPending());
        assertFalse(index.getFoldingModel().isCollapsed(0));
        assertEquals(List.of(new FoldToggle(0, 2, true)), toggles);
        assertEquals(List.of(new FoldRegion(0, 3, 0)), index.getRegions());
    }

    @Test
    public void sameLineEditKeepsCollapsedRegion() {
        InMemoryDocument doc = new InMemoryDocument(BLOCK);
        DocumentStructureIndex index = new DocumentStructureIndex(doc, debouncer, 4);
        index.getFoldingModel().fold(0);

        doc.insertString(doc.getLineStartOffset(1) + 7, "changed ");
        debouncer.runPending();

        assertTrue(index.getFoldingModel().isCollapsed(0));
        assertFalse(index.getFoldingModel().isLineVisible(2));
    }

    @Test
    public void flushRescansWithoutWaiting() {
        InMemoryDocument doc = new InMemoryDocument("");
        DocumentStructureIndex index = new DocumentStructureIndex(doc, debouncer, 4);

        doc.insertString(0, "<ul>\n    <li>x</li>\n</ul>");
        index.flush();

        assertFalse(debouncer.isPending());
        assertFalse(index.isStale());
        assertEquals(List.of(new FoldRegion(0, 1, 0)), index.getRegions());
    }

    @Test
    public void scanFailureIsReportedToListeners() {
        FailingDocument doc = new FailingDocument("<p></p>");
        Logger quiet = Logger.getAnonymousLogger();
        quiet.setUseParentHandlers(false);
        quiet.setLevel(Level.OFF);
        DocumentStructureIndex index = new DocumentStructureIndex(doc, debouncer, 4, quiet);

        List<Throwable> failures = new ArrayList<>();
        index.addStructureListener(new StructureListener() {
            @Override
            public void structureUpdated(TagIndex tags, List<FoldRegion> regions) {
                fail("unexpected update");
            }

            @Override
            public void structureFailed(Throwable error) {
                failures.add(error);
            }
        });

        doc.insertString(3, "x");
        doc.failReads = true;
        debouncer.runPending();

        assertEquals(1, failures.size());
        assertInstanceOf(IllegalStateException.class, failures.get(0));
        // The previous snapshot stays in place.
        assertEquals(2, index.getTagIndex().getTokens().size());
    }

    @Test
    public void disposeDetachesFromDocument() {
        InMemoryDocument doc = new InMemoryDocument("<p></p>");
        DocumentStructureIndex index = new DocumentStructureIndex(doc, debouncer, 4);

        index.dispose();
        doc.insertString(0, "<b></b>");

        assertFalse(debouncer.isPending());
        assertEquals(0, debouncer.getScheduleCount());
    }

    /**
     * Document whose text reads can be made to fail, to exercise error reporting.
     */
    private static final class FailingDocument implements ObservableDocument {

        private final InMemoryDocument delegate;
        boolean failReads;

        FailingDocument(String text) {
            this.delegate = new InMemoryDocument(text);
        }

        @Override
        public String getText() {
            if (failReads) {
                throw new IllegalStateException("read failed");
            }
            return delegate.getText();
        }

        @Override
        public int getTextLength() {
            return delegate.getTextLength();
        }

        @Override
        public void replace(int start, int end, String text) {
            delegate.replace(start, end, text);
        }

        @Override
        public void insertString(int offset, String text) {
            delegate.insertString(offset, text);
        }

        @Override
        public void deleteString(int start, int end) {
            delegate.deleteString(start, end);
        }

        @Override
        public String getText(int start, int length) {
            return delegate.getText(start, length);
        }

        @Override
        public int getLineCount() {
            return delegate.getLineCount();
        }

        @Override
        public int getLineNumber(int offset) {
            return delegate.getLineNumber(offset);
        }

        @Override
        public int getLineStartOffset(int line) {
            return delegate.getLineStartOffset(line);
        }

        @Override
        public void addDocumentListener(DocumentListener listener) {
            delegate.addDocumentListener(listener);
        }

        @Override
        public void removeDocumentListener(DocumentListener listener) {
            delegate.removeDocumentListener(listener);
        }

        @Override
        public long getModificationStamp() {
            return delegate.getModificationStamp();
        }
    }
}
