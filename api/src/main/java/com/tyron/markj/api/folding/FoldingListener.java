package com.tyron.markj.api.folding;

/**
 * Receives visibility changes from a {@link FoldingModel}, typically to hide or show line views and
 * to repaint the fold indicator in the gutter.
 */
public interface FoldingListener {

    void foldToggled(FoldToggle toggle);
}
