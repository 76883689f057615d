package com.tyron.markj.core.editor;

import com.tyron.markj.api.concurrent.Debouncer;
import com.tyron.markj.api.diagnostics.Diagnostic;
import com.tyron.markj.api.diagnostics.MarkupChecker;
import com.tyron.markj.api.editor.Document;
import com.tyron.markj.api.editor.Editor;
import com.tyron.markj.api.editor.HighlightSpan;
import com.tyron.markj.api.editor.ObservableDocument;
import com.tyron.markj.api.folding.FoldRegion;
import com.tyron.markj.api.html.TagMatch;
import com.tyron.markj.api.html.TagToken;
import com.tyron.markj.api.service.Disposable;
import com.tyron.markj.core.bookmarks.BookmarkStore;
import com.tyron.markj.core.folding.FoldStateTracker;
import com.tyron.markj.core.html.check.MarkupCheckers;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Editor actions for one open HTML file.
 *
 * Binds an {@link Editor} to the structure index of its document, the shared bookmark store and the
 * configured checkers. Every action works on the caret position at the time it is invoked.
 */
public final class HtmlEditorSession implements Disposable {

    private static final Logger LOG = Logger.getLogger(HtmlEditorSession.class.getName());

    private final Editor editor;
    private final DocumentStructureIndex structure;
    private final BookmarkStore bookmarks;
    private final String path;
    private final List<MarkupChecker> checkers;

    public HtmlEditorSession(@NotNull Editor editor,
                             @NotNull DocumentStructureIndex structure,
                             @NotNull BookmarkStore bookmarks,
                             @NotNull String path,
                             @NotNull List<MarkupChecker> checkers) {
        this.editor = Objects.requireNonNull(editor, "editor");
        this.structure = Objects.requireNonNull(structure, "structure");
        this.bookmarks = Objects.requireNonNull(bookmarks, "bookmarks");
        this.path = Objects.requireNonNull(path, "path");
        this.checkers = List.copyOf(checkers);
        if (editor.getDocument() != structure.getDocument()) {
            throw new IllegalArgumentException("editor and structure index must share the same document");
        }
    }

    /**
     * Creates a session with its own structure index and the default checkers.
     */
    public static HtmlEditorSession open(@NotNull Editor editor,
                                         @NotNull Debouncer debouncer,
                                         int indentUnit,
                                         @NotNull BookmarkStore bookmarks,
                                         @NotNull String path) {
        Document document = editor.getDocument();
        if (!(document instanceof ObservableDocument)) {
            throw new IllegalArgumentException("document must be observable: " + document.getClass().getName());
        }
        DocumentStructureIndex structure = new DocumentStructureIndex((ObservableDocument) document, debouncer, indentUnit);
        return new HtmlEditorSession(editor, structure, bookmarks, path, MarkupCheckers.defaults());
    }

    public Editor getEditor() {
        return editor;
    }

    public DocumentStructureIndex getStructure() {
        return structure;
    }

    public FoldStateTracker getFoldingModel() {
        return structure.getFoldingModel();
    }

    public String getPath() {
        return path;
    }

    public TagMatch matchAtCaret() {
        return structure.matchTag(editor.getCaretModel().getOffset());
    }

    /**
     * Ranges to paint for the tag under the caret: none, the tag alone, or the tag and its partner.
     */
    public List<HighlightSpan> tagHighlightsAtCaret() {
        return matchAtCaret().toHighlightSpans();
    }

    /**
     * Moves the caret to the start of the partner of the tag under the caret.
     *
     * @return true if the caret moved
     */
    public boolean jumpToMatchingTag() {
        Optional<TagToken> partner = matchAtCaret().getPartner();
        if (partner.isEmpty()) {
            return false;
        }
        int target = partner.get().getStartOffset();
        if (target > editor.getDocument().getTextLength()) {
            // Index not caught up with a deletion yet.
            return false;
        }
        editor.getCaretModel().moveToOffset(target);
        editor.scrollToCaret();
        return true;
    }

    /**
     * Toggles the fold starting on the caret line, or folds the innermost region containing it.
     *
     * When a containing region is folded the caret moves to the start of its first line, which stays
     * visible. A caret left on a line hidden by a collapsed region unfolds that region instead.
     *
     * @return true if a region changed state
     */
    public boolean toggleFoldAtCaret() {
        FoldStateTracker folds = structure.getFoldingModel();
        int line = caretLine();

        if (folds.getRegion(line).isPresent()) {
            return folds.toggle(line);
        }

        Optional<FoldRegion> region = folds.findRegionForLine(line);
        if (region.isEmpty()) {
            return false;
        }
        if (folds.isCollapsed(region.get().startLine())) {
            // Caret is on a hidden line.
            return folds.unfold(region.get().startLine());
        }
        if (!folds.fold(region.get().startLine())) {
            return false;
        }
        editor.getCaretModel().moveToOffset(editor.getDocument().getLineStartOffset(region.get().startLine()));
        editor.scrollToCaret();
        return true;
    }

    /**
     * @return true if the caret line is now bookmarked
     */
    public boolean toggleBookmarkAtCaret() {
        return bookmarks.toggle(path, caretLine());
    }

    public boolean nextBookmark() {
        return moveToBookmark(bookmarks.next(path, caretLine(), editor.getDocument().getLineCount()));
    }

    public boolean previousBookmark() {
        return moveToBookmark(bookmarks.previous(path, caretLine(), editor.getDocument().getLineCount()));
    }

    /**
     * Runs the checkers over the current tag index, rescanning first if it is out of date.
     */
    public List<Diagnostic> getDiagnostics() {
        if (structure.isStale()) {
            structure.flush();
        }
        List<Diagnostic> diagnostics = MarkupCheckers.runAll(
                checkers, structure.getTagIndex().getTokens(), editor.getDocument().getText());
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(path + ": " + diagnostics.size() + " diagnostic(s)");
        }
        return diagnostics;
    }

    private boolean moveToBookmark(OptionalInt line) {
        if (line.isEmpty()) {
            return false;
        }
        editor.getCaretModel().moveToOffset(editor.getDocument().getLineStartOffset(line.getAsInt()));
        editor.scrollToCaret();
        return true;
    }

    private int caretLine() {
        return editor.getDocument().getLineNumber(editor.getCaretModel().getOffset());
    }

    @Override
    public void dispose() {
        structure.dispose();
    }
}
