package com.tyron.markj.desktop.folding;

import com.tyron.markj.api.folding.FoldRegion;
import com.tyron.markj.core.folding.FoldRegionDetector;
import org.fife.ui.rsyntaxtextarea.RSyntaxTextArea;
import org.fife.ui.rsyntaxtextarea.folding.Fold;
import org.fife.ui.rsyntaxtextarea.folding.FoldParser;
import org.fife.ui.rsyntaxtextarea.folding.FoldType;

import javax.swing.text.BadLocationException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Supplies RSyntaxTextArea with the indentation-based fold regions, so the gutter shows the same
 * regions the folding model works with.
 *
 * Regions are detected from the text area's current content, which keeps the gutter consistent with
 * the text even while a structure rescan is pending.
 */
public final class StructureFoldParser implements FoldParser {

    private static final Logger LOG = Logger.getLogger(StructureFoldParser.class.getName());

    private final FoldRegionDetector detector;

    public StructureFoldParser() {
        this(new FoldRegionDetector());
    }

    public StructureFoldParser(FoldRegionDetector detector) {
        this.detector = detector;
    }

    @Override
    public List<Fold> getFolds(RSyntaxTextArea textArea) {
        List<Fold> roots = new ArrayList<>();
        List<FoldRegion> regions = detector.detect(textArea.getText());

        // Regions are ordered by start line and nest properly.
        Deque<Open> open = new ArrayDeque<>();
        try {
            for (FoldRegion region : regions) {
                while (!open.isEmpty() && open.peek().region.endLine() < region.endLine()) {
                    open.pop();
                }

                int startOffs = textArea.getLineStartOffset(region.startLine());
                Fold fold;
                if (open.isEmpty()) {
                    fold = new Fold(FoldType.CODE, textArea, startOffs);
                    roots.add(fold);
                } else {
                    fold = open.peek().fold.createChild(FoldType.CODE, startOffs);
                }
                fold.setEndOffset(Math.max(startOffs, textArea.getLineEndOffset(region.endLine()) - 1));
                open.push(new Open(region, fold));
            }
        } catch (BadLocationException e) {
            // The text changed under us; RSyntaxTextArea reparses after the next edit.
            LOG.log(Level.FINE, "Fold parse aborted", e);
        }
        return roots;
    }

    private static final class Open {
        final FoldRegion region;
        final Fold fold;

        Open(FoldRegion region, Fold fold) {
            this.region = region;
            this.fold = fold;
        }
    }
}
