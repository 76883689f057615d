package com.tyron.markj.core.folding;

import com.tyron.markj.api.folding.FoldRegion;
import com.tyron.markj.api.folding.FoldToggle;
import com.tyron.markj.api.folding.FoldingListener;
import com.tyron.markj.api.folding.FoldingModel;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link FoldingModel} for a single document.
 *
 * Keeps the current region table (keyed by start line), the regions collapsed by the user with the
 * region as it was when collapsed, and the resulting set of hidden lines. When the region table is
 * replaced, a collapsed region survives only if a region with the same start line and end line still
 * exists; otherwise it is dropped and its lines become visible again.
 *
 * Not thread-safe: owned by the thread that edits the document.
 */
public final class FoldStateTracker implements FoldingModel {

    private final Logger log;
    private final int indentUnit;

    private final TreeMap<Integer, FoldRegion> regions = new TreeMap<>();
    private final TreeMap<Integer, FoldRegion> collapsed = new TreeMap<>();
    private final BitSet hiddenLines = new BitSet();
    private final CopyOnWriteArrayList<FoldingListener> listeners = new CopyOnWriteArrayList<>();

    public FoldStateTracker(int indentUnit) {
        this(indentUnit, Logger.getLogger(FoldStateTracker.class.getName()));
    }

    public FoldStateTracker(int indentUnit, Logger log) {
        if (indentUnit <= 0) {
            throw new IllegalArgumentException("indentUnit must be positive: " + indentUnit);
        }
        this.indentUnit = indentUnit;
        this.log = Objects.requireNonNull(log, "log");
    }

    public int getIndentUnit() {
        return indentUnit;
    }

    /**
     * Replaces the region table and drops collapsed regions that no longer match it.
     *
     * @return number of collapsed regions that were dropped
     */
    public int updateRegions(@NotNull Collection<FoldRegion> newRegions) {
        Objects.requireNonNull(newRegions, "newRegions");

        regions.clear();
        for (FoldRegion region : newRegions) {
            if (region.endLine() > region.startLine()) {
                regions.put(region.startLine(), region);
            }
        }

        List<FoldRegion> dropped = new ArrayList<>();
        Iterator<Map.Entry<Integer, FoldRegion>> it = collapsed.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Integer, FoldRegion> entry = it.next();
            FoldRegion snapshot = entry.getValue();
            FoldRegion current = regions.get(entry.getKey());
            if (current == null || current.endLine() != snapshot.endLine()) {
                it.remove();
                dropped.add(snapshot);
            } else {
                entry.setValue(current);
            }
        }

        rebuildHiddenLines();

        if (!dropped.isEmpty() && log.isLoggable(Level.FINE)) {
            log.fine("Dropped " + dropped.size() + " stale collapsed regions " + dropped);
        }
        for (FoldRegion region : dropped) {
            fire(new FoldToggle(region.startLine(), region.endLine(), true));
        }
        return dropped.size();
    }

    @Override
    public boolean fold(int startLine) {
        FoldRegion region = regions.get(startLine);
        if (region == null) {
            if (log.isLoggable(Level.FINE)) {
                log.fine("fold: line " + startLine + " is not a fold start");
            }
            return false;
        }
        if (collapsed.containsKey(startLine)) {
            return false;
        }

        collapsed.put(startLine, region);
        rebuildHiddenLines();
        fire(new FoldToggle(region.startLine(), region.endLine(), false));
        return true;
    }

    @Override
    public boolean unfold(int startLine) {
        FoldRegion region = collapsed.remove(startLine);
        if (region == null) {
            return false;
        }

        rebuildHiddenLines();
        fire(new FoldToggle(region.startLine(), region.endLine(), true));
        return true;
    }

    @Override
    public boolean toggle(int startLine) {
        return collapsed.containsKey(startLine) ? unfold(startLine) : fold(startLine);
    }

    @Override
    public int foldAll() {
        int count = 0;
        for (Integer start : new ArrayList<>(regions.keySet())) {
            if (fold(start)) count++;
        }
        return count;
    }

    @Override
    public int unfoldAll() {
        int count = 0;
        for (Integer start : new ArrayList<>(collapsed.keySet())) {
            if (unfold(start)) count++;
        }
        return count;
    }

    @Override
    public int foldAtLevel(int level) {
        if (level < 0) {
            return 0;
        }
        int wantedIndent = level * indentUnit;
        int count = 0;
        for (FoldRegion region : new ArrayList<>(regions.values())) {
            if (region.indent() == wantedIndent && fold(region.startLine())) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean isCollapsed(int startLine) {
        return collapsed.containsKey(startLine);
    }

    @Override
    public boolean isLineVisible(int line) {
        return line >= 0 && !hiddenLines.get(line);
    }

    public int getHiddenLineCount() {
        return hiddenLines.cardinality();
    }

    @Override
    public @NotNull Optional<FoldRegion> findRegionForLine(int line) {
        // Regions nest properly, so the containing region with the greatest start is the innermost.
        NavigableMap<Integer, FoldRegion> candidates = regions.headMap(line, true).descendingMap();
        for (FoldRegion region : candidates.values()) {
            if (region.contains(line)) {
                return Optional.of(region);
            }
        }
        return Optional.empty();
    }

    public @NotNull Optional<FoldRegion> getRegion(int startLine) {
        return Optional.ofNullable(regions.get(startLine));
    }

    @Override
    public @NotNull List<FoldRegion> getRegions() {
        return List.copyOf(regions.values());
    }

    @Override
    public @NotNull List<FoldRegion> getCollapsedRegions() {
        return List.copyOf(collapsed.values());
    }

    @Override
    public void addFoldingListener(@NotNull FoldingListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeFoldingListener(@NotNull FoldingListener listener) {
        listeners.remove(listener);
    }

    private void rebuildHiddenLines() {
        hiddenLines.clear();
        for (FoldRegion region : collapsed.values()) {
            hiddenLines.set(region.startLine() + 1, region.endLine() + 1);
        }
    }

    private void fire(FoldToggle toggle) {
        for (FoldingListener listener : listeners) {
            listener.foldToggled(toggle);
        }
    }
}
