package com.tyron.markj.core.editor;

import com.tyron.markj.api.folding.FoldRegion;
import com.tyron.markj.core.html.TagIndex;

import java.util.List;

/**
 * Observes rescans of a {@link DocumentStructureIndex}.
 */
public interface StructureListener {

    /**
     * Called after a rescan replaced the tag index and the fold region table.
     */
    void structureUpdated(TagIndex tagIndex, List<FoldRegion> regions);

    /**
     * Called when a rescan failed unexpectedly. The previous index stays in place and editing
     * continues; implementations typically show a non-blocking notification.
     */
    default void structureFailed(Throwable error) {
    }
}
