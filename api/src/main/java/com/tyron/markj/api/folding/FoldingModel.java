package com.tyron.markj.api.folding;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * Collapsed/expanded state of the fold regions of one document.
 *
 * Operations that cannot apply (unknown opener, already folded, not folded) return {@code false} or a
 * count of zero rather than throwing.
 */
public interface FoldingModel {

    boolean fold(int startLine);

    boolean unfold(int startLine);

    boolean toggle(int startLine);

    /**
     * @return number of regions that were collapsed by this call
     */
    int foldAll();

    /**
     * @return number of regions that were expanded by this call
     */
    int unfoldAll();

    /**
     * Collapses only regions whose opener indentation is {@code level * indentUnit}.
     *
     * @return number of regions that were collapsed by this call
     */
    int foldAtLevel(int level);

    boolean isCollapsed(int startLine);

    boolean isLineVisible(int line);

    /**
     * @return the innermost region containing {@code line}
     */
    @NotNull Optional<FoldRegion> findRegionForLine(int line);

    @NotNull List<FoldRegion> getRegions();

    @NotNull List<FoldRegion> getCollapsedRegions();

    void addFoldingListener(@NotNull FoldingListener listener);

    void removeFoldingListener(@NotNull FoldingListener listener);
}
