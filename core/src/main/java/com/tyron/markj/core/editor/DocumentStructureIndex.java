package com.tyron.markj.core.editor;

import com.tyron.markj.api.concurrent.Debouncer;
import com.tyron.markj.api.editor.DocumentEvent;
import com.tyron.markj.api.editor.DocumentListener;
import com.tyron.markj.api.editor.ObservableDocument;
import com.tyron.markj.api.folding.FoldRegion;
import com.tyron.markj.api.html.TagMatch;
import com.tyron.markj.api.service.Disposable;
import com.tyron.markj.core.folding.FoldRegionDetector;
import com.tyron.markj.core.folding.FoldStateTracker;
import com.tyron.markj.core.html.HtmlTagTokenizer;
import com.tyron.markj.core.html.TagIndex;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tag and fold structure of one open document, kept up to date from change events.
 *
 * Every edit restarts the rescan delay; the rescan rebuilds the {@link TagIndex} and the fold region
 * table from a fresh text snapshot. Edits that change the line count additionally recompute the fold
 * regions right away, so collapsed regions that no longer line up are expanded before the next paint.
 *
 * All methods must be called on the thread that owns the document (the UI thread), which is also the
 * thread the {@link Debouncer} runs rescans on.
 */
public final class DocumentStructureIndex implements Disposable {

    private final ObservableDocument document;
    private final Debouncer debouncer;
    private final Logger log;

    private final HtmlTagTokenizer tokenizer = new HtmlTagTokenizer();
    private final FoldRegionDetector detector;
    private final FoldStateTracker foldState;
    private final CopyOnWriteArrayList<StructureListener> listeners = new CopyOnWriteArrayList<>();
    private final DocumentListener documentListener = this::documentChanged;

    private TagIndex tagIndex = TagIndex.empty();
    private List<FoldRegion> regions = List.of();
    private boolean disposed;

    public DocumentStructureIndex(ObservableDocument document, Debouncer debouncer, int indentUnit) {
        this(document, debouncer, indentUnit, Logger.getLogger(DocumentStructureIndex.class.getName()));
    }

    public DocumentStructureIndex(ObservableDocument document, Debouncer debouncer, int indentUnit, Logger log) {
        this.document = Objects.requireNonNull(document, "document");
        this.debouncer = Objects.requireNonNull(debouncer, "debouncer");
        this.log = Objects.requireNonNull(log, "log");
        this.detector = new FoldRegionDetector(log);
        this.foldState = new FoldStateTracker(indentUnit, log);

        rescan();
        document.addDocumentListener(documentListener);
    }

    private void documentChanged(DocumentEvent event) {
        if (disposed) {
            return;
        }
        if (event.isLineCountChanged()) {
            recomputeFolds();
        }
        debouncer.schedule(this::rescan);
    }

    /**
     * Cancels the pending rescan, if any, and rescans immediately.
     */
    public void flush() {
        debouncer.cancel();
        rescan();
    }

    /**
     * @return true if the document changed since the last rescan
     */
    public boolean isStale() {
        return tagIndex.getModificationStamp() != document.getModificationStamp();
    }

    public TagIndex getTagIndex() {
        return tagIndex;
    }

    public List<FoldRegion> getRegions() {
        return regions;
    }

    public FoldStateTracker getFoldingModel() {
        return foldState;
    }

    public ObservableDocument getDocument() {
        return document;
    }

    public TagMatch matchTag(int offset) {
        return tagIndex.match(offset);
    }

    public void addStructureListener(StructureListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeStructureListener(StructureListener listener) {
        listeners.remove(listener);
    }

    private void rescan() {
        if (disposed) {
            return;
        }
        long start = System.nanoTime();
        try {
            long stamp = document.getModificationStamp();
            String text = document.getText();

            tagIndex = TagIndex.build(tokenizer, text, stamp);
            regions = detector.detect(text);
            foldState.updateRegions(regions);
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Structure rescan failed", e);
            for (StructureListener listener : listeners) {
                listener.structureFailed(e);
            }
            return;
        }

        if (log.isLoggable(Level.FINE)) {
            long micros = (System.nanoTime() - start) / 1_000L;
            log.fine("Rescanned: tags=" + tagIndex.getTokens().size() + " regions=" + regions.size() + " (" + micros + "us)");
        }
        for (StructureListener listener : listeners) {
            listener.structureUpdated(tagIndex, regions);
        }
    }

    private void recomputeFolds() {
        try {
            regions = detector.detect(document.getText());
            foldState.updateRegions(regions);
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Fold recomputation failed", e);
            for (StructureListener listener : listeners) {
                listener.structureFailed(e);
            }
        }
    }

    @Override
    public void dispose() {
        disposed = true;
        document.removeDocumentListener(documentListener);
        debouncer.cancel();
        listeners.clear();
    }
}
