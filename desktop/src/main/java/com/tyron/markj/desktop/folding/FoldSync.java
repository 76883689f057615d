package com.tyron.markj.desktop.folding;

import com.tyron.markj.api.folding.FoldToggle;
import com.tyron.markj.api.folding.FoldingListener;
import org.fife.ui.rsyntaxtextarea.RSyntaxTextArea;
import org.fife.ui.rsyntaxtextarea.folding.Fold;
import org.fife.ui.rsyntaxtextarea.folding.FoldManager;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies folding-model toggles to the text area's gutter folds.
 *
 * Toggles flow one way: the folding model drives the view. Clicks on the gutter fold icons stay
 * local to the text area.
 */
public final class FoldSync implements FoldingListener {

    private static final Logger LOG = Logger.getLogger(FoldSync.class.getName());

    private final RSyntaxTextArea textArea;

    public FoldSync(RSyntaxTextArea textArea) {
        this.textArea = textArea;
    }

    @Override
    public void foldToggled(FoldToggle toggle) {
        FoldManager manager = textArea.getFoldManager();
        Fold fold = manager.getFoldForLine(toggle.startLine());
        if (fold == null) {
            // Gutter folds are reparsed lazily; ask for a fresh set and retry once.
            manager.reparse();
            fold = manager.getFoldForLine(toggle.startLine());
        }
        if (fold == null) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("No gutter fold at line " + toggle.startLine());
            }
            return;
        }

        boolean collapse = !toggle.visible();
        if (fold.isCollapsed() != collapse) {
            fold.setCollapsed(collapse);
            textArea.revalidate();
            textArea.repaint();
        }
    }
}
